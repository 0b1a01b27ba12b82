package com.codefarm.shorturl.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "shorturl")
public record ShortUrlProperties(
        @DefaultValue Cache cache,
        @DefaultValue Generator generator,
        @DefaultValue Access access,
        @DefaultValue Store store
) {

    /**
     * @param ttl         upper bound for how long a resolved URL stays cached
     * @param maximumSize entries kept before eviction
     */
    public record Cache(
            @DefaultValue("1h") Duration ttl,
            @DefaultValue("10000") long maximumSize
    ) {
    }

    /**
     * @param recentCodesSize codes remembered by the in-process collision guard
     * @param maxAttempts     sequence values tried per generation call
     * @param insertAttempts  regenerate-and-insert rounds after a store conflict
     */
    public record Generator(
            @DefaultValue("100000") long recentCodesSize,
            @DefaultValue("5") int maxAttempts,
            @DefaultValue("3") int insertAttempts
    ) {
    }

    /**
     * @param timeout     budget for one background access recording
     * @param maxAttempts optimistic concurrency retries per access
     */
    public record Access(
            @DefaultValue("2s") Duration timeout,
            @DefaultValue("3") int maxAttempts,
            @DefaultValue Executor executor
    ) {
        public record Executor(
                @DefaultValue("2") int corePoolSize,
                @DefaultValue("8") int maxPoolSize,
                @DefaultValue("500") int queueCapacity
        ) {
        }
    }

    /**
     * @param timeout upper bound for one store transaction and for each query inside it
     */
    public record Store(
            @DefaultValue("5s") Duration timeout
    ) {
    }
}
