package com.pos.checkout.controller;

import com.pos.checkout.domain.LoyaltyAccount;
import com.pos.checkout.domain.LoyaltyReferenceType;
import com.pos.checkout.domain.LoyaltyTransactionType;
import com.pos.checkout.dto.LoyaltyAdjustmentRequest;
import com.pos.checkout.dto.LoyaltyBalanceChange;
import com.pos.checkout.exception.CheckoutException;
import com.pos.checkout.service.ILoyaltyLedgerService;
import com.pos.checkout.util.TraceIdUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * 积分账户接口：开户、查询余额、人工调整。
 * 账本错误（余额不足）由 GlobalExceptionHandler 渲染。
 */
@Slf4j
@RestController
@RequestMapping("/api/loyalty/accounts")
public class LoyaltyController {

    private final ILoyaltyLedgerService loyaltyLedgerService;

    public LoyaltyController(ILoyaltyLedgerService loyaltyLedgerService) {
        this.loyaltyLedgerService = loyaltyLedgerService;
    }

    @PostMapping("/{customerId}")
    public ResponseEntity<Map<String, Object>> openAccount(@PathVariable String customerId) {
        LoyaltyAccount account = loyaltyLedgerService.openAccount(customerId);
        return ResponseEntity.ok(success(account));
    }

    @GetMapping("/{customerId}")
    public ResponseEntity<Map<String, Object>> getAccount(@PathVariable String customerId) {
        LoyaltyAccount account = loyaltyLedgerService.getAccount(customerId);
        if (account == null) {
            Map<String, Object> response = new HashMap<>();
            response.put("code", "NOT_FOUND");
            response.put("message", "No loyalty account for customer " + customerId);
            response.put("traceId", TraceIdUtil.getTraceId());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
        }
        return ResponseEntity.ok(success(account));
    }

    @PostMapping("/{customerId}/adjustments")
    public ResponseEntity<Map<String, Object>> adjust(@PathVariable String customerId,
                                                      @RequestBody LoyaltyAdjustmentRequest request) {
        if (request.getPoints() == null || request.getPoints() == 0) {
            throw CheckoutException.validation("points must be a non-zero integer");
        }
        log.info("[积分调整请求] customerId={}, points={}, referenceId={}, traceId={}",
                customerId, request.getPoints(), request.getReferenceId(), TraceIdUtil.getTraceId());
        LoyaltyBalanceChange change = loyaltyLedgerService.applyDelta(customerId, request.getPoints(),
                LoyaltyTransactionType.ADJUSTED, LoyaltyReferenceType.MANUAL, request.getReferenceId());
        return ResponseEntity.ok(success(change));
    }

    private Map<String, Object> success(Object data) {
        Map<String, Object> response = new HashMap<>();
        response.put("code", "SUCCESS");
        response.put("data", data);
        response.put("traceId", TraceIdUtil.getTraceId());
        return response;
    }
}
