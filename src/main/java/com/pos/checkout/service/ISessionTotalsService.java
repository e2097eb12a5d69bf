package com.pos.checkout.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.pos.checkout.domain.RegisterSession;

import java.math.BigDecimal;

/**
 * 收银会话累计汇总。尽力而为：这里的失败不会让已支付的结账失败。
 */
public interface ISessionTotalsService extends IService<RegisterSession> {

    RegisterSession openSession(String sessionId, String locationId);

    /**
     * 在会话行锁下将一笔已支付订单计入会话汇总。
     *
     * @return 订单已计入时返回 false
     * @throws com.pos.checkout.exception.SessionNotFoundException 会话不存在时
     */
    boolean recordPayment(String sessionId, String orderId, BigDecimal cashAmount, BigDecimal cardAmount);
}
