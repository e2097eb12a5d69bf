package com.pos.checkout.controller;

import com.pos.checkout.service.IInventoryReservationService;
import com.pos.checkout.util.TraceIdUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/inventory")
public class InventoryController {

    private final IInventoryReservationService inventoryReservationService;

    public InventoryController(IInventoryReservationService inventoryReservationService) {
        this.inventoryReservationService = inventoryReservationService;
    }

    /**
     * On-hand minus active reservations for one product at one location.
     */
    @GetMapping("/{productId}/availability")
    public ResponseEntity<Map<String, Object>> availability(@PathVariable String productId,
                                                            @RequestParam String locationId) {
        String traceId = TraceIdUtil.getTraceId();
        BigDecimal available = inventoryReservationService.availableQuantity(productId, locationId);

        Map<String, Object> data = new HashMap<>();
        data.put("productId", productId);
        data.put("locationId", locationId);
        data.put("available", available);

        Map<String, Object> response = new HashMap<>();
        response.put("code", "SUCCESS");
        response.put("data", data);
        response.put("traceId", traceId);
        return ResponseEntity.ok(response);
    }
}
