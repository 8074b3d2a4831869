package com.shardrouter.infrastructure.config;

import com.shardrouter.infrastructure.filter.RoutingContextFilter;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.Parameter;
import org.springdoc.core.customizers.OperationCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Shard Router API")
                        .version("1.0")
                        .description("Topology inspection and routing dry-runs"));
    }

    @Bean
    public OperationCustomizer addRoutingTargetHeader() {
        return (operation, handlerMethod) -> {
            StringSchema schema = new StringSchema();
            schema.setEnum(List.of("primary", "replica"));
            operation.addParametersItem(new Parameter()
                    .in("header")
                    .name(RoutingContextFilter.ROUTING_TARGET_HEADER)
                    .description("Forces every read of the request to this role")
                    .required(false)
                    .schema(schema));
            return operation;
        };
    }
}
