package com.pos.checkout.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.pos.checkout.config.CheckoutProperties;
import com.pos.checkout.domain.LoyaltyAccount;
import com.pos.checkout.domain.LoyaltyHold;
import com.pos.checkout.domain.LoyaltyHoldStatus;
import com.pos.checkout.domain.LoyaltyProgram;
import com.pos.checkout.domain.LoyaltyReferenceType;
import com.pos.checkout.domain.LoyaltyTransaction;
import com.pos.checkout.domain.LoyaltyTransactionType;
import com.pos.checkout.dto.LoyaltyBalanceChange;
import com.pos.checkout.exception.CheckoutException;
import com.pos.checkout.exception.InsufficientLoyaltyBalanceException;
import com.pos.checkout.exception.LoyaltyAccountNotFoundException;
import com.pos.checkout.mapper.LoyaltyAccountMapper;
import com.pos.checkout.mapper.LoyaltyHoldMapper;
import com.pos.checkout.mapper.LoyaltyProgramMapper;
import com.pos.checkout.mapper.LoyaltyTransactionMapper;
import com.pos.checkout.service.ILoyaltyLedgerService;
import com.pos.checkout.util.TraceIdUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

@Slf4j
@Service
public class LoyaltyLedgerServiceImpl extends ServiceImpl<LoyaltyTransactionMapper, LoyaltyTransaction>
        implements ILoyaltyLedgerService {

    private static final BigDecimal MAX_POINTS = BigDecimal.valueOf(Integer.MAX_VALUE);

    private final LoyaltyAccountMapper loyaltyAccountMapper;
    private final LoyaltyHoldMapper loyaltyHoldMapper;
    private final LoyaltyProgramMapper loyaltyProgramMapper;
    private final CheckoutProperties checkoutProperties;

    public LoyaltyLedgerServiceImpl(LoyaltyAccountMapper loyaltyAccountMapper,
                                    LoyaltyHoldMapper loyaltyHoldMapper,
                                    LoyaltyProgramMapper loyaltyProgramMapper,
                                    CheckoutProperties checkoutProperties) {
        this.loyaltyAccountMapper = loyaltyAccountMapper;
        this.loyaltyHoldMapper = loyaltyHoldMapper;
        this.loyaltyProgramMapper = loyaltyProgramMapper;
        this.checkoutProperties = checkoutProperties;
    }

    @Override
    public LoyaltyAccount openAccount(String customerId) {
        LoyaltyAccount existing = getAccount(customerId);
        if (existing != null) {
            return existing;
        }
        LocalDateTime now = LocalDateTime.now();
        LoyaltyAccount account = LoyaltyAccount.builder()
                .customerId(customerId)
                .pointsBalance(0)
                .version(0)
                .createTime(now)
                .updateTime(now)
                .build();
        try {
            loyaltyAccountMapper.insert(account);
            log.info("[积分账户已开通] customerId={}, traceId={}", customerId, TraceIdUtil.getTraceId());
            return account;
        } catch (DuplicateKeyException e) {
            // opened concurrently
            return getAccount(customerId);
        }
    }

    @Override
    public LoyaltyAccount getAccount(String customerId) {
        return loyaltyAccountMapper.selectOne(new LambdaQueryWrapper<LoyaltyAccount>()
                .eq(LoyaltyAccount::getCustomerId, customerId));
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public LoyaltyBalanceChange applyDelta(String customerId, int pointsDelta, LoyaltyTransactionType type,
                                           LoyaltyReferenceType referenceType, String referenceId) {
        LoyaltyAccount account = lockAccount(customerId);
        int balanceBefore = account.getPointsBalance();

        if (pointsDelta < 0) {
            int held = loyaltyHoldMapper.sumActivePoints(customerId);
            int redeemable = balanceBefore - held;
            if (redeemable + pointsDelta < 0) {
                log.warn("[积分变动被拒绝] customerId={}, delta={}, balance={}, held={}, traceId={}",
                        customerId, pointsDelta, balanceBefore, held, TraceIdUtil.getTraceId());
                throw new InsufficientLoyaltyBalanceException(customerId, -pointsDelta, Math.max(redeemable, 0));
            }
        }

        int balanceAfter = appendEntry(customerId, balanceBefore, pointsDelta, type, referenceType, referenceId, null);
        loyaltyAccountMapper.updateBalance(account.getId(), balanceAfter);

        log.info("[积分变动已入账] customerId={}, type={}, delta={}, balanceBefore={}, balanceAfter={}, traceId={}",
                customerId, type, pointsDelta, balanceBefore, balanceAfter, TraceIdUtil.getTraceId());
        return new LoyaltyBalanceChange(balanceBefore, balanceAfter);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public LoyaltyBalanceChange applyCheckout(String customerId, int pointsSpent, int pointsEarned, String orderId) {
        String traceId = TraceIdUtil.getTraceId();

        // ==================== 1. Lock the account ====================
        LoyaltyAccount account = lockAccount(customerId);
        int balanceBefore = account.getPointsBalance();

        // ==================== 2. Already applied for this order ====================
        if (hasEntriesForOrder(orderId)) {
            log.warn("[跳过结账积分] already applied, customerId={}, orderId={}, traceId={}",
                    customerId, orderId, traceId);
            loyaltyHoldMapper.closeActiveForOrder(orderId, LoyaltyHoldStatus.CONSUMED, LocalDateTime.now());
            return new LoyaltyBalanceChange(balanceBefore, balanceBefore);
        }

        // ==================== 3. Spend first, earn on the remainder ====================
        if (pointsSpent > balanceBefore) {
            throw new InsufficientLoyaltyBalanceException(customerId, pointsSpent, balanceBefore);
        }
        int balance = balanceBefore;
        if (pointsSpent > 0) {
            balance = appendEntry(customerId, balance, -pointsSpent, LoyaltyTransactionType.SPENT,
                    LoyaltyReferenceType.ORDER, orderId, "Redeemed at checkout");
        }
        if (pointsEarned > 0) {
            balance = appendEntry(customerId, balance, pointsEarned, LoyaltyTransactionType.EARNED,
                    LoyaltyReferenceType.ORDER, orderId, "Earned at checkout");
        }

        // ==================== 4. Balance and hold ====================
        loyaltyAccountMapper.updateBalance(account.getId(), balance);
        loyaltyHoldMapper.closeActiveForOrder(orderId, LoyaltyHoldStatus.CONSUMED, LocalDateTime.now());

        log.info("[结账积分已入账] customerId={}, orderId={}, spent={}, earned={}, balanceBefore={}, balanceAfter={}, traceId={}",
                customerId, orderId, pointsSpent, pointsEarned, balanceBefore, balance, traceId);
        return new LoyaltyBalanceChange(balanceBefore, balance);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public LoyaltyHold placeHold(String customerId, int points, String orderId) {
        LoyaltyAccount account = lockAccount(customerId);
        int held = loyaltyHoldMapper.sumActivePoints(customerId);
        int redeemable = account.getPointsBalance() - held;
        if (redeemable < points) {
            log.warn("[积分冻结被拒绝] customerId={}, requested={}, balance={}, held={}, orderId={}, traceId={}",
                    customerId, points, account.getPointsBalance(), held, orderId, TraceIdUtil.getTraceId());
            throw new InsufficientLoyaltyBalanceException(customerId, points, Math.max(redeemable, 0));
        }

        LocalDateTime now = LocalDateTime.now();
        LoyaltyHold hold = LoyaltyHold.builder()
                .customerId(customerId)
                .orderId(orderId)
                .points(points)
                .status(LoyaltyHoldStatus.ACTIVE)
                .expiresAt(now.plus(checkoutProperties.getReservationTtl()))
                .createTime(now)
                .updateTime(now)
                .build();
        loyaltyHoldMapper.insert(hold);

        log.info("[积分已冻结] customerId={}, points={}, redeemableAfter={}, orderId={}, traceId={}",
                customerId, points, redeemable - points, orderId, TraceIdUtil.getTraceId());
        return hold;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public int releaseHold(String orderId) {
        int released = loyaltyHoldMapper.closeActiveForOrder(orderId, LoyaltyHoldStatus.RELEASED, LocalDateTime.now());
        if (released > 0) {
            log.info("[积分冻结已释放] orderId={}, traceId={}", orderId, TraceIdUtil.getTraceId());
        }
        return released;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public int expireHolds() {
        int expired = loyaltyHoldMapper.expireOverdue(LocalDateTime.now());
        if (expired > 0) {
            log.info("[积分冻结清理] expired={}", expired);
        }
        return expired;
    }

    @Override
    public int calculatePointsToEarn(String vendorId, BigDecimal eligibleAmount) {
        if (eligibleAmount == null || eligibleAmount.signum() <= 0) {
            return 0;
        }
        LoyaltyProgram program = loyaltyProgramMapper.selectOne(new LambdaQueryWrapper<LoyaltyProgram>()
                .eq(LoyaltyProgram::getVendorId, vendorId)
                .eq(LoyaltyProgram::getActive, true));
        if (program == null || program.getPointsPerDollar() == null) {
            return 0;
        }
        BigDecimal points = eligibleAmount.multiply(program.getPointsPerDollar()).setScale(0, RoundingMode.FLOOR);
        if (points.compareTo(MAX_POINTS) > 0) {
            log.warn("[积分获取被拒绝] vendorId={}, eligibleAmount={}, points={}, traceId={}",
                    vendorId, eligibleAmount, points, TraceIdUtil.getTraceId());
            throw CheckoutException.validation("Points earned on " + eligibleAmount + " (" + points
                    + ") exceed the largest loyalty balance of " + Integer.MAX_VALUE);
        }
        return points.intValue();
    }

    @Override
    public boolean hasEntriesForOrder(String orderId) {
        return lambdaQuery()
                .eq(LoyaltyTransaction::getReferenceType, LoyaltyReferenceType.ORDER)
                .eq(LoyaltyTransaction::getReferenceId, orderId)
                .count() > 0;
    }

    private LoyaltyAccount lockAccount(String customerId) {
        LoyaltyAccount account = loyaltyAccountMapper.selectForUpdate(customerId);
        if (account == null) {
            throw new LoyaltyAccountNotFoundException(customerId);
        }
        return account;
    }

    /**
     * @return balance after the entry
     */
    private int appendEntry(String customerId, int balanceBefore, int points, LoyaltyTransactionType type,
                            LoyaltyReferenceType referenceType, String referenceId, String description) {
        if ((long) balanceBefore + points > Integer.MAX_VALUE) {
            throw CheckoutException.validation("Balance of customer " + customerId + " cannot grow by " + points
                    + " points past " + Integer.MAX_VALUE);
        }
        int balanceAfter = balanceBefore + points;
        save(LoyaltyTransaction.builder()
                .customerId(customerId)
                .transactionType(type)
                .points(points)
                .balanceBefore(balanceBefore)
                .balanceAfter(balanceAfter)
                .referenceType(referenceType)
                .referenceId(referenceId)
                .description(description)
                .traceId(TraceIdUtil.getTraceId())
                .createTime(LocalDateTime.now())
                .build());
        return balanceAfter;
    }
}
