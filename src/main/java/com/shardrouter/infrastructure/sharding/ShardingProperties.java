package com.shardrouter.infrastructure.sharding;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the routing topology.
 *
 * Example configuration:
 * <pre>
 * routing:
 *   default-shard: default
 *   shards:
 *     default:
 *       primary: { host: db-main, database: app, username: app, password: secret }
 *       replica: { host: db-main-ro, database: app, username: app, password: secret }
 *     shard_0:
 *       primary: { host: db-s0, database: app_shard_0, username: app, password: secret }
 *   models:
 *     accounts:
 *       sharded: true
 *       replica-by-default: true
 *       shard-attribute: account_id
 *       shard-strategy: hashed
 *     account_tags:
 *       inherit-from: accounts
 * </pre>
 *
 * A shard without a replica serves replica reads from its primary.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "routing")
public class ShardingProperties {

    @NotBlank
    private String defaultShard = "default";

    @NotBlank
    private String jdbcSubprotocol = "postgresql";

    @Valid
    private Pool pool = new Pool();

    @Valid
    private Map<String, Shard> shards = new LinkedHashMap<>();

    @Valid
    private Map<String, Model> models = new LinkedHashMap<>();

    public String getDefaultShard() {
        return defaultShard;
    }

    public void setDefaultShard(String defaultShard) {
        this.defaultShard = defaultShard;
    }

    public String getJdbcSubprotocol() {
        return jdbcSubprotocol;
    }

    public void setJdbcSubprotocol(String jdbcSubprotocol) {
        this.jdbcSubprotocol = jdbcSubprotocol;
    }

    public Pool getPool() {
        return pool;
    }

    public void setPool(Pool pool) {
        this.pool = pool;
    }

    public Map<String, Shard> getShards() {
        return shards;
    }

    public void setShards(Map<String, Shard> shards) {
        this.shards = shards;
    }

    public Map<String, Model> getModels() {
        return models;
    }

    public void setModels(Map<String, Model> models) {
        this.models = models;
    }

    public static class Pool {
        @Min(1)
        private int maxPoolSize = 20;
        @Min(0)
        private int minIdle = 5;

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getMinIdle() {
            return minIdle;
        }

        public void setMinIdle(int minIdle) {
            this.minIdle = minIdle;
        }
    }

    public static class Shard {
        @NotNull
        @Valid
        private Endpoint primary;
        @Valid
        private Endpoint replica;

        public Endpoint getPrimary() {
            return primary;
        }

        public void setPrimary(Endpoint primary) {
            this.primary = primary;
        }

        public Endpoint getReplica() {
            return replica;
        }

        public void setReplica(Endpoint replica) {
            this.replica = replica;
        }
    }

    public static class Endpoint {
        @NotBlank
        private String host;
        @Min(1)
        @Max(65535)
        private int port = 5432;
        @NotBlank
        private String database;
        private String username;
        private String password;

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getDatabase() {
            return database;
        }

        public void setDatabase(String database) {
            this.database = database;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }
    }

    public static class Model {
        private boolean sharded = false;
        private boolean replicaByDefault = false;
        private String shardAttribute;
        private ShardStrategy shardStrategy = ShardStrategy.DIRECT;
        private String inheritFrom;

        public boolean isSharded() {
            return sharded;
        }

        public void setSharded(boolean sharded) {
            this.sharded = sharded;
        }

        public boolean isReplicaByDefault() {
            return replicaByDefault;
        }

        public void setReplicaByDefault(boolean replicaByDefault) {
            this.replicaByDefault = replicaByDefault;
        }

        public String getShardAttribute() {
            return shardAttribute;
        }

        public void setShardAttribute(String shardAttribute) {
            this.shardAttribute = shardAttribute;
        }

        public ShardStrategy getShardStrategy() {
            return shardStrategy;
        }

        public void setShardStrategy(ShardStrategy shardStrategy) {
            this.shardStrategy = shardStrategy;
        }

        public String getInheritFrom() {
            return inheritFrom;
        }

        public void setInheritFrom(String inheritFrom) {
            this.inheritFrom = inheritFrom;
        }
    }

    /**
     * How a sharded model's shard-attribute maps to a shard.
     */
    public enum ShardStrategy {
        /** The attribute holds the shard key itself. */
        DIRECT,
        /** The attribute value is hashed over the configured shards. */
        HASHED
    }
}
