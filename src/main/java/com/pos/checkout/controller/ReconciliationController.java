package com.pos.checkout.controller;

import com.pos.checkout.business.ReconciliationRepairService;
import com.pos.checkout.domain.ReconciliationKind;
import com.pos.checkout.domain.ReconciliationQueueItem;
import com.pos.checkout.service.IReconciliationQueueService;
import com.pos.checkout.util.TraceIdUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 对账队列运维接口
 * - 查询未处理的队列项，可按类型过滤
 * - 人工标记为已处理（幂等）
 * - 立即触发修复，无需等待重试任务
 */
@Slf4j
@RestController
@RequestMapping("/api/reconciliation")
public class ReconciliationController {

    private final IReconciliationQueueService reconciliationQueueService;
    private final ReconciliationRepairService reconciliationRepairService;

    public ReconciliationController(IReconciliationQueueService reconciliationQueueService,
                                    ReconciliationRepairService reconciliationRepairService) {
        this.reconciliationQueueService = reconciliationQueueService;
        this.reconciliationRepairService = reconciliationRepairService;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> listUnresolved(@RequestParam(required = false) ReconciliationKind kind) {
        List<ReconciliationQueueItem> items = reconciliationQueueService.listUnresolved(kind);
        Map<String, Object> response = new HashMap<>();
        response.put("code", "SUCCESS");
        response.put("data", items);
        response.put("traceId", TraceIdUtil.getTraceId());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{id}/resolve")
    public ResponseEntity<Map<String, Object>> resolve(@PathVariable Long id,
                                                       @RequestParam(required = false) String notes) {
        boolean resolved = reconciliationQueueService.resolve(id, notes);
        log.info("[对账人工处理] itemId={}, changed={}, traceId={}", id, resolved, TraceIdUtil.getTraceId());
        Map<String, Object> response = new HashMap<>();
        response.put("code", "SUCCESS");
        response.put("message", resolved ? "Resolved" : "Already resolved");
        response.put("traceId", TraceIdUtil.getTraceId());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{id}/repair")
    public ResponseEntity<Map<String, Object>> repair(@PathVariable Long id) {
        String notes = reconciliationRepairService.repairById(id);
        Map<String, Object> response = new HashMap<>();
        response.put("code", "SUCCESS");
        response.put("message", notes);
        response.put("traceId", TraceIdUtil.getTraceId());
        return ResponseEntity.ok(response);
    }
}
