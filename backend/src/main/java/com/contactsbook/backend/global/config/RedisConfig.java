package com.contactsbook.backend.global.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.TimeoutOptions;

import org.springframework.boot.autoconfigure.data.redis.LettuceClientConfigurationBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Lettuce client options for the session cache. Commands issued while disconnected are rejected
 * immediately and every command is bounded by {@code spring.data.redis.timeout}.
 */
@Configuration(proxyBeanMethods = false)
public class RedisConfig {

    @Bean
    public LettuceClientConfigurationBuilderCustomizer sessionCacheClientOptions() {
        return builder -> builder.clientOptions(ClientOptions.builder()
                .autoReconnect(true)
                .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                .timeoutOptions(TimeoutOptions.enabled())
                .build());
    }
}
