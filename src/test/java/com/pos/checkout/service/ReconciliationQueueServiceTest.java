package com.pos.checkout.service;

import com.pos.checkout.AbstractLedgerIntegrationTest;
import com.pos.checkout.domain.ReconciliationKind;
import com.pos.checkout.domain.ReconciliationQueueItem;
import com.pos.checkout.dto.ReconciliationPayload;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class ReconciliationQueueServiceTest extends AbstractLedgerIntegrationTest {

    @Autowired
    private IReconciliationQueueService reconciliationQueueService;

    @Test
    void enqueuedItemIsUnresolvedAndKeepsItsPayload() {
        String orderId = newId("order");

        ReconciliationQueueItem item = reconciliationQueueService.enqueue(orderId, ReconciliationKind.SESSION_TOTALS,
                ReconciliationPayload.builder()
                        .sessionId("session-9")
                        .cashAmount(new BigDecimal("12.50"))
                        .cardAmount(BigDecimal.ZERO)
                        .errorMessage("session row locked")
                        .build());

        ReconciliationQueueItem stored = reconciliationQueueService.getById(item.getId());
        assertThat(stored.getResolved()).isFalse();
        assertThat(stored.getRetryCount()).isZero();
        assertThat(stored.getMaxRetries()).isEqualTo(5);
        assertThat(stored.getLastError()).isEqualTo("session row locked");
        assertThat(stored.getNextRetryAt()).isAfter(LocalDateTime.now());

        ReconciliationPayload payload = reconciliationQueueService.readPayload(stored);
        assertThat(payload.getSessionId()).isEqualTo("session-9");
        assertThat(payload.getCashAmount()).isEqualByComparingTo("12.50");

        assertThat(reconciliationQueueService.hasUnresolved(orderId, ReconciliationKind.SESSION_TOTALS)).isTrue();
        assertThat(reconciliationQueueService.hasUnresolved(orderId, ReconciliationKind.LOYALTY_UPDATE)).isFalse();
        assertThat(reconciliationQueueService.listUnresolved(ReconciliationKind.SESSION_TOTALS))
                .extracting(ReconciliationQueueItem::getId)
                .contains(item.getId());
        assertThat(reconciliationQueueService.listUnresolved(ReconciliationKind.INVENTORY_FINALIZE))
                .extracting(ReconciliationQueueItem::getId)
                .doesNotContain(item.getId());
    }

    @Test
    void resolveIsIdempotent() {
        ReconciliationQueueItem item = reconciliationQueueService.enqueue(newId("order"),
                ReconciliationKind.LOYALTY_UPDATE, ReconciliationPayload.builder().customerId("c-1").build());

        assertThat(reconciliationQueueService.resolve(item.getId(), "applied by hand")).isTrue();
        assertThat(reconciliationQueueService.resolve(item.getId(), "second attempt")).isFalse();

        ReconciliationQueueItem stored = reconciliationQueueService.getById(item.getId());
        assertThat(stored.getResolved()).isTrue();
        assertThat(stored.getResolutionNotes()).isEqualTo("applied by hand");
        assertThat(stored.getResolvedAt()).isNotNull();
        assertThat(reconciliationQueueService.listUnresolved(null))
                .extracting(ReconciliationQueueItem::getId)
                .doesNotContain(item.getId());
    }

    @Test
    void failedRetriesBackOffUntilExhausted() {
        ReconciliationQueueItem item = reconciliationQueueService.enqueue(newId("order"),
                ReconciliationKind.INVENTORY_FINALIZE, ReconciliationPayload.builder().build());

        LocalDateTime before = LocalDateTime.now();
        reconciliationQueueService.markRetryFailed(item.getId(), "lock timeout");
        ReconciliationQueueItem first = reconciliationQueueService.getById(item.getId());
        assertThat(first.getRetryCount()).isEqualTo(1);
        assertThat(first.getLastError()).isEqualTo("lock timeout");
        // 30s * 2^1
        assertThat(first.getNextRetryAt()).isAfter(before.plusSeconds(59));

        reconciliationQueueService.markRetryFailed(item.getId(), "lock timeout");
        ReconciliationQueueItem second = reconciliationQueueService.getById(item.getId());
        assertThat(second.getNextRetryAt()).isAfter(before.plusSeconds(119));

        for (int i = 0; i < 3; i++) {
            reconciliationQueueService.markRetryFailed(item.getId(), "x".repeat(2000));
        }
        ReconciliationQueueItem exhausted = reconciliationQueueService.getById(item.getId());
        assertThat(exhausted.getRetryCount()).isEqualTo(5);
        assertThat(exhausted.getLastError()).hasSize(1000);
        assertThat(exhausted.getResolved()).isFalse();

        // due but out of retries
        reconciliationQueueService.lambdaUpdate()
                .set(ReconciliationQueueItem::getNextRetryAt, LocalDateTime.now().minusMinutes(1))
                .eq(ReconciliationQueueItem::getId, item.getId())
                .update();
        assertThat(reconciliationQueueService.listDueForRetry())
                .extracting(ReconciliationQueueItem::getId)
                .doesNotContain(item.getId());
    }
}
