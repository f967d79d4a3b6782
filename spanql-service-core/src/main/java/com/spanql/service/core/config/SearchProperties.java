package com.spanql.service.core.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "spanql.search")
public class SearchProperties {
    private int defaultLimit = 20;
    private int maxLimit = 1000;
    private int defaultSpansPerSpanSet = 3;
    private int maxSpansPerSpanSet = 100;
    /** Shards scanned at most by a {@code most_recent} search. */
    private int mostRecentShards = 200;

    private Duration queryTimeout = Duration.ofSeconds(30);
    private Executor executor = new Executor();
    private Store store = new Store();

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }

    public int getDefaultSpansPerSpanSet() {
        return defaultSpansPerSpanSet;
    }

    public void setDefaultSpansPerSpanSet(int defaultSpansPerSpanSet) {
        this.defaultSpansPerSpanSet = defaultSpansPerSpanSet;
    }

    public int getMaxSpansPerSpanSet() {
        return maxSpansPerSpanSet;
    }

    public void setMaxSpansPerSpanSet(int maxSpansPerSpanSet) {
        this.maxSpansPerSpanSet = maxSpansPerSpanSet;
    }

    public int getMostRecentShards() {
        return mostRecentShards;
    }

    public void setMostRecentShards(int mostRecentShards) {
        this.mostRecentShards = mostRecentShards;
    }

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    public void setQueryTimeout(Duration queryTimeout) {
        this.queryTimeout = queryTimeout;
    }

    public Executor getExecutor() {
        return executor;
    }

    public void setExecutor(Executor executor) {
        this.executor = executor;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public static class Executor {
        private int workers = 8;

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }
    }

    public static class Store {
        /** Width of the time buckets the in-memory source shards traces into. */
        private Duration shardWidth = Duration.ofHours(1);

        public Duration getShardWidth() {
            return shardWidth;
        }

        public void setShardWidth(Duration shardWidth) {
            this.shardWidth = shardWidth;
        }
    }
}
