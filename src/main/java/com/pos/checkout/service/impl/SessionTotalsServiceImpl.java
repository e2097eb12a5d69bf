package com.pos.checkout.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.pos.checkout.domain.RegisterSession;
import com.pos.checkout.domain.SessionPayment;
import com.pos.checkout.exception.SessionNotFoundException;
import com.pos.checkout.mapper.RegisterSessionMapper;
import com.pos.checkout.mapper.SessionPaymentMapper;
import com.pos.checkout.service.ISessionTotalsService;
import com.pos.checkout.util.TraceIdUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Slf4j
@Service
public class SessionTotalsServiceImpl extends ServiceImpl<RegisterSessionMapper, RegisterSession>
        implements ISessionTotalsService {

    private final SessionPaymentMapper sessionPaymentMapper;

    public SessionTotalsServiceImpl(SessionPaymentMapper sessionPaymentMapper) {
        this.sessionPaymentMapper = sessionPaymentMapper;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public RegisterSession openSession(String sessionId, String locationId) {
        RegisterSession existing = getById(sessionId);
        if (existing != null) {
            return existing;
        }
        LocalDateTime now = LocalDateTime.now();
        RegisterSession session = RegisterSession.builder()
                .sessionId(sessionId)
                .locationId(locationId)
                .totalSales(BigDecimal.ZERO)
                .cashSales(BigDecimal.ZERO)
                .cardSales(BigDecimal.ZERO)
                .transactionCount(0)
                .createTime(now)
                .updateTime(now)
                .build();
        save(session);
        log.info("[收银会话已开启] sessionId={}, locationId={}", sessionId, locationId);
        return session;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public boolean recordPayment(String sessionId, String orderId, BigDecimal cashAmount, BigDecimal cardAmount) {
        String traceId = TraceIdUtil.getTraceId();

        // ==================== 1. Lock the session ====================
        RegisterSession session = baseMapper.selectForUpdate(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }

        // ==================== 2. Already counted? ====================
        Long counted = sessionPaymentMapper.selectCount(new LambdaQueryWrapper<SessionPayment>()
                .eq(SessionPayment::getSessionId, sessionId)
                .eq(SessionPayment::getOrderId, orderId));
        if (counted != null && counted > 0) {
            log.info("[跳过会话汇总] already recorded, sessionId={}, orderId={}, traceId={}",
                    sessionId, orderId, traceId);
            return false;
        }

        // ==================== 3. Marker + totals ====================
        sessionPaymentMapper.insert(SessionPayment.builder()
                .sessionId(sessionId)
                .orderId(orderId)
                .cashAmount(cashAmount)
                .cardAmount(cardAmount)
                .createTime(LocalDateTime.now())
                .build());
        baseMapper.addPayment(sessionId, cashAmount.add(cardAmount), cashAmount, cardAmount);

        log.info("[会话汇总已更新] sessionId={}, orderId={}, cash={}, card={}, traceId={}",
                sessionId, orderId, cashAmount, cardAmount, traceId);
        return true;
    }
}
