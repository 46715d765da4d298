package com.phoneauth.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Redis configuration for OTP, rate-limit and revocation storage.
 *
 * This class configures the Redis connection and the template used by the
 * Redis-backed stores. It uses Lettuce as the Redis client connector.
 *
 * Features:
 * - Configurable Redis host, port and password
 * - Command timeout so that an unreachable cache fails the request instead of
 *   hanging it (surfaced as STORE_UNAVAILABLE by the stores)
 * - String serialization for keys and values (readable in Redis CLI and
 *   compatible with the Lua scripts the stores run)
 *
 * @see org.springframework.data.redis.core.StringRedisTemplate
 * @see org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory
 */
@Configuration
@Slf4j
public class RedisConfig {

    @Value("${spring.data.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.data.redis.port:6379}")
    private int redisPort;

    @Value("${spring.data.redis.password:}")
    private String redisPassword;

    @Value("${spring.data.redis.timeout:2s}")
    private Duration redisTimeout;

    /**
     * Configure Redis connection factory.
     *
     * Creates a Lettuce-based connection factory with standalone configuration
     * and a bounded command timeout.
     *
     * @return configured RedisConnectionFactory
     */
    @Bean
    public RedisConnectionFactory redisConnectionFactory() {
        RedisStandaloneConfiguration config = new RedisStandaloneConfiguration();
        config.setHostName(redisHost);
        config.setPort(redisPort);
        if (StringUtils.hasText(redisPassword)) {
            config.setPassword(RedisPassword.of(redisPassword));
        }

        LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
                .commandTimeout(redisTimeout)
                .build();

        log.info("Configuring Redis connection factory: host={}, port={}, timeout={}",
                redisHost, redisPort, redisTimeout);

        return new LettuceConnectionFactory(config, clientConfig);
    }

    /**
     * Configure the String template shared by the OTP, rate-limit and
     * revocation stores.
     *
     * @param redisConnectionFactory the Redis connection factory
     * @return configured StringRedisTemplate
     */
    @Bean
    public StringRedisTemplate redisStringTemplate(RedisConnectionFactory redisConnectionFactory) {
        StringRedisTemplate template = new StringRedisTemplate(redisConnectionFactory);
        log.debug("StringRedisTemplate configured for auth stores");
        return template;
    }
}
