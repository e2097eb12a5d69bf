package com.pos.checkout.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.pos.checkout.domain.SessionPayment;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface SessionPaymentMapper extends BaseMapper<SessionPayment> {
}
