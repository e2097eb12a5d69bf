package com.pos.checkout.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * checkout.* 配置项
 */
@Data
@ConfigurationProperties(prefix = "checkout")
public class CheckoutProperties {

    /**
     * Lifetime of inventory reservations and loyalty holds before the sweep reclaims them
     */
    private Duration reservationTtl = Duration.ofMinutes(15);

    /**
     * Upper bound on one gateway charge call (customer interaction at the terminal)
     */
    private Duration paymentTimeout = Duration.ofSeconds(120);

    /**
     * Lookups by idempotency key after a charge timed out
     */
    private int paymentPollAttempts = 3;

    private Duration paymentPollInterval = Duration.ofSeconds(2);

    /**
     * How long a duplicate request waits for the in-flight one before answering CheckoutInProgress
     */
    private Duration replayWait = Duration.ofSeconds(130);

    private Duration replayPollInterval = Duration.ofMillis(250);

    /**
     * Lease of the distributed idempotency-key lock; must outlive a full checkout
     */
    private Duration idempotencyLockLease = Duration.ofMinutes(5);

    /**
     * Totals above this are logged as unusual, not rejected
     */
    private BigDecimal maxWalkInAmount = new BigDecimal("50000");

    private BigDecimal amountTolerance = new BigDecimal("0.01");

    private Reconciliation reconciliation = new Reconciliation();

    @Data
    public static class Reconciliation {
        private int maxRetries = 5;
        private Duration initialRetryDelay = Duration.ofSeconds(30);
        private int batchSize = 50;
    }
}
