package com.resona.config;

import com.resona.storage.ObjectStorageProvider;
import com.resona.storage.RedisObjectStorageProvider;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

/**
 * Redis as the remote cache tier backend ({@code resona.cache.remote.backend=redis}).
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "resona.cache.remote", name = "backend", havingValue = "redis")
public class RedisConfiguration {

    /**
     * Connection factory with timeouts below the health probe timeout.
     */
    @Bean
    public LettuceConnectionFactory redisConnectionFactory(RedisProperties redisProperties,
                                                           ResonaProperties properties) {
        Duration timeout = properties.getHealth().getTimeout();

        SocketOptions socketOptions = SocketOptions.builder()
                .connectTimeout(timeout)
                .keepAlive(true)
                .build();

        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(socketOptions)
                .autoReconnect(true)
                .timeoutOptions(TimeoutOptions.enabled(timeout))
                .build();

        LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
                .clientOptions(clientOptions)
                .commandTimeout(timeout)
                .build();

        RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(
                redisProperties.getHost(), redisProperties.getPort());
        LettuceConnectionFactory factory = new LettuceConnectionFactory(server, clientConfig);

        log.info("Configured Redis connection factory for {}:{} (timeout {})",
                redisProperties.getHost(), redisProperties.getPort(), timeout);
        return factory;
    }

    /**
     * Redis template for byte array storage (compressed audio payloads).
     */
    @Bean
    public RedisTemplate<String, byte[]> audioRedisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, byte[]> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(RedisSerializer.byteArray());
        template.afterPropertiesSet();
        return template;
    }

    @Bean
    public ObjectStorageProvider redisObjectStorageProvider(RedisTemplate<String, byte[]> audioRedisTemplate,
                                                            ResonaProperties properties) {
        log.info("Remote cache tier backed by Redis");
        return new RedisObjectStorageProvider(audioRedisTemplate, properties.getCache().getTtl());
    }
}
