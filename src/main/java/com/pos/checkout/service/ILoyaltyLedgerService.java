package com.pos.checkout.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.pos.checkout.domain.LoyaltyAccount;
import com.pos.checkout.domain.LoyaltyHold;
import com.pos.checkout.domain.LoyaltyReferenceType;
import com.pos.checkout.domain.LoyaltyTransaction;
import com.pos.checkout.domain.LoyaltyTransactionType;
import com.pos.checkout.dto.LoyaltyBalanceChange;

import java.math.BigDecimal;

/**
 * 积分账本
 *
 * 每次余额变更都持有账户行锁，在同一事务中追加 LoyaltyTransaction 记录并改写余额，
 * 同一客户的并发抵扣因此串行执行。
 */
public interface ILoyaltyLedgerService extends IService<LoyaltyTransaction> {

    /**
     * 以零余额开户，已存在时返回现有账户。
     */
    LoyaltyAccount openAccount(String customerId);

    LoyaltyAccount getAccount(String customerId);

    /**
     * 单次带符号的积分变动。
     *
     * @throws com.pos.checkout.exception.InsufficientLoyaltyBalanceException 负数变动后余额
     *         少于处理中抵扣的冻结积分时
     */
    LoyaltyBalanceChange applyDelta(String customerId, int pointsDelta, LoyaltyTransactionType type,
                                    LoyaltyReferenceType referenceType, String referenceId);

    /**
     * 在一次加锁内完成订单的积分抵扣与获取，并消耗该订单的冻结。
     * 同一订单重复调用不做任何修改。
     */
    LoyaltyBalanceChange applyCheckout(String customerId, int pointsSpent, int pointsEarned, String orderId);

    /**
     * 为尚未支付的抵扣冻结积分。
     *
     * @throws com.pos.checkout.exception.InsufficientLoyaltyBalanceException 余额减去 ACTIVE 冻结后不足时
     */
    LoyaltyHold placeHold(String customerId, int points, String orderId);

    /**
     * @return 释放的冻结数（没有 ACTIVE 冻结时为 0）
     */
    int releaseHold(String orderId);

    int expireHolds();

    /**
     * 按商户生效中的积分规则计算 floor(eligibleAmount * pointsPerDollar)，无规则时为 0。
     *
     * @throws com.pos.checkout.exception.CheckoutException 积分超出余额上限时，kind 为
     *                                                     VALIDATION_ERROR
     */
    int calculatePointsToEarn(String vendorId, BigDecimal eligibleAmount);

    boolean hasEntriesForOrder(String orderId);
}
