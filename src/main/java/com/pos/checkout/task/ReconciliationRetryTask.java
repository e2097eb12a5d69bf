package com.pos.checkout.task;

import com.pos.checkout.business.ReconciliationRepairService;
import com.pos.checkout.domain.ReconciliationQueueItem;
import com.pos.checkout.service.IReconciliationQueueService;
import com.pos.checkout.util.TraceIdUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 对账重试任务
 * - 拉取到期需要重试的未处理队列项
 * - 执行修复；失败时 nextRetryAt 按指数推迟，直到 maxRetries
 */
@Slf4j
@Component
@EnableScheduling
public class ReconciliationRetryTask {

    private final IReconciliationQueueService reconciliationQueueService;
    private final ReconciliationRepairService reconciliationRepairService;
    private final boolean enabled;

    public ReconciliationRetryTask(IReconciliationQueueService reconciliationQueueService,
                                   ReconciliationRepairService reconciliationRepairService,
                                   @Value("${checkout.reconciliation.retry.enabled:true}") boolean enabled) {
        this.reconciliationQueueService = reconciliationQueueService;
        this.reconciliationRepairService = reconciliationRepairService;
        this.enabled = enabled;
    }

    @Scheduled(fixedDelayString = "${checkout.reconciliation.retry.fixed-delay:30000}", initialDelay = 5000)
    public void retryDueItems() {
        if (!enabled) {
            return;
        }
        try {
            int repaired = runOnce();
            if (repaired > 0) {
                log.info("[对账重试任务] repaired={}", repaired);
            }
        } catch (Exception e) {
            log.error("[对账重试任务异常] errorMsg={}", e.getMessage(), e);
        }
    }

    /**
     * @return number of items repaired in this pass
     */
    public int runOnce() {
        // ==================== 1. Due items ====================
        List<ReconciliationQueueItem> due = reconciliationQueueService.listDueForRetry();
        if (due.isEmpty()) {
            return 0;
        }

        // ==================== 2. Repair one by one ====================
        int repaired = 0;
        for (ReconciliationQueueItem item : due) {
            TraceIdUtil.setTraceId(item.getTraceId() != null ? item.getTraceId() : TraceIdUtil.generateTraceId());
            try {
                reconciliationRepairService.repairById(item.getId());
                repaired++;
            } catch (Exception e) {
                // already recorded on the item by the repair service
                log.debug("[对账重试延后] itemId={}, retryCount={}", item.getId(), item.getRetryCount());
            } finally {
                TraceIdUtil.clearTraceId();
            }
        }
        return repaired;
    }
}
