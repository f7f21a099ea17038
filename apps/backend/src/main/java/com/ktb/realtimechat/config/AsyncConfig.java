package com.ktb.realtimechat.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.Executors;

@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean("messageExecutor")
    public Executor messageExecutor() {
        return Executors.newFixedThreadPool(4);
    }

    /**
     * 연결별 전송 큐 drain 작업 실행용.
     * 연결마다 동시에 최대 하나의 drain 만 돌기 때문에 스레드 수가 동시에 쓰기 중인 연결 수의 상한이다.
     */
    @Bean("deliveryExecutor")
    public Executor deliveryExecutor(
            @Value("${chat.websocket.delivery-threads:16}") int deliveryThreads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("ws-delivery-");
        executor.setCorePoolSize(deliveryThreads);
        executor.setMaxPoolSize(deliveryThreads);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.initialize();
        return executor;
    }
}
