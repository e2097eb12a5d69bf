package com.pos.checkout.controller;

import com.pos.checkout.business.CheckoutOrchestrator;
import com.pos.checkout.dto.CheckoutRequest;
import com.pos.checkout.dto.CheckoutResult;
import com.pos.checkout.util.TraceIdUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 结账接口。HTTP 状态码由结果的错误类型决定（成功为 200）。
 */
@Slf4j
@RestController
@RequestMapping("/api/checkout")
public class CheckoutController {

    private final CheckoutOrchestrator checkoutOrchestrator;

    public CheckoutController(CheckoutOrchestrator checkoutOrchestrator) {
        this.checkoutOrchestrator = checkoutOrchestrator;
    }

    @PostMapping
    public ResponseEntity<CheckoutResult> checkout(@RequestBody CheckoutRequest request) {
        log.info("[结账请求] idempotencyKey={}, vendorId={}, locationId={}, traceId={}",
                request.getIdempotencyKey(), request.getVendorId(), request.getLocationId(), TraceIdUtil.getTraceId());
        CheckoutResult result = checkoutOrchestrator.checkout(request);
        return ResponseEntity.status(result.httpStatus()).body(result);
    }
}
