package com.mm.chartdata.config;

import io.lettuce.core.resource.DefaultClientResources;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/** Redis holds the shared stored-procedure whitelist. */
@Configuration
public class RedisConfig {
    @Value("${REDIS_HOST:localhost}")
    private String host;

    @Value("${REDIS_PORT:6379}")
    private int port;

    // true for managed Redis with in-transit encryption
    @Value("${REDIS_SSL:false}")
    private boolean ssl;

    // Redis 6+ ACL user, often "default"
    @Value("${REDIS_USERNAME:}")
    private String username;

    @Value("${REDIS_PASSWORD:}")
    private String password;

    @Value("${REDIS_TIMEOUT_MS:3000}")
    private int timeoutMs;

    @Bean(destroyMethod = "shutdown")
    DefaultClientResources lettuceClientResources() {
        return DefaultClientResources.create();
    }

    @Bean
    public LettuceConnectionFactory redisConnectionFactory(DefaultClientResources resources) {
        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(host, port);

        if (username != null && !username.isBlank()) {
            standalone.setUsername(username);
        }
        if (password != null && !password.isBlank()) {
            standalone.setPassword(RedisPassword.of(password));
        }

        LettuceClientConfiguration.LettuceClientConfigurationBuilder b = LettuceClientConfiguration.builder()
                .clientResources(resources)
                .commandTimeout(Duration.ofMillis(timeoutMs));

        if (ssl) {
            b.useSsl();
        }

        return new LettuceConnectionFactory(standalone, b.build());
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(LettuceConnectionFactory connectionFactory) {
        StringRedisTemplate template = new StringRedisTemplate(connectionFactory);
        template.afterPropertiesSet();
        return template;
    }
}
