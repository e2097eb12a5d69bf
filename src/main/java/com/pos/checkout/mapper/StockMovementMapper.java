package com.pos.checkout.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.pos.checkout.domain.StockMovement;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface StockMovementMapper extends BaseMapper<StockMovement> {
}
