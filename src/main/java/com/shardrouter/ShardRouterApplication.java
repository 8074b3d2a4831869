package com.shardrouter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ShardRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShardRouterApplication.class, args);
    }
}
