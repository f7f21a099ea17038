package com.ktb.realtimechat.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.api.StatefulConnection;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Pub/Sub 발행용 Redis 연결.
 * 구독은 RedisMessageListenerContainer 가 같은 팩토리에서 전용 연결을 따로 잡는다.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "chat.broadcast.type", havingValue = "redis", matchIfMissing = true)
public class RedisConfig {

    @Value("${chat.redis.pool.max-total:16}")
    private int poolMaxTotal;

    // 발행은 전송 경로 위에 있으므로 풀에서 오래 기다리지 않는다
    @Value("${chat.redis.pool.max-wait:500ms}")
    private Duration poolMaxWait;

    @Value("${chat.redis.connect-timeout:5s}")
    private Duration connectTimeout;

    @Value("${chat.redis.command-timeout:3s}")
    private Duration commandTimeout;

    @Bean
    public RedisConnectionFactory redisConnectionFactory(
            @Value("${spring.data.redis.host}") String host,
            @Value("${spring.data.redis.port}") int port,
            @Value("${spring.data.redis.password:}") String password) {

        RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(host, port);
        if (password != null && !password.isBlank()) {
            server.setPassword(password);
        }

        log.info("Redis 연결 설정 - {}:{}, pool: {}, commandTimeout: {}", host, port, poolMaxTotal, commandTimeout);
        return new LettuceConnectionFactory(server, lettuceClientConfiguration());
    }

    @Bean
    @Primary
    public StringRedisTemplate redisTemplate(RedisConnectionFactory redisConnectionFactory) {
        return new StringRedisTemplate(redisConnectionFactory);
    }

    private LettuceClientConfiguration lettuceClientConfiguration() {
        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(SocketOptions.builder().connectTimeout(connectTimeout).build())
                .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                .build();

        return LettucePoolingClientConfiguration.builder()
                .poolConfig(publishPool())
                .commandTimeout(commandTimeout)
                .clientOptions(clientOptions)
                .build();
    }

    private GenericObjectPoolConfig<StatefulConnection<?, ?>> publishPool() {
        GenericObjectPoolConfig<StatefulConnection<?, ?>> pool = new GenericObjectPoolConfig<>();
        pool.setMaxTotal(poolMaxTotal);
        pool.setMaxIdle(Math.max(1, poolMaxTotal / 2));
        pool.setMinIdle(Math.max(1, poolMaxTotal / 4));
        pool.setMaxWait(poolMaxWait);
        return pool;
    }
}
