package com.pos.checkout.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 网关调用使用独立线程池，结账线程可以在超时后停止等待。
 */
@Configuration
public class PaymentExecutorConfig {

    @Bean(name = "paymentExecutor", destroyMethod = "shutdown")
    public ExecutorService paymentExecutor() {
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("payment-gateway-" + thread.getId());
            thread.setDaemon(true);
            return thread;
        });
    }
}
