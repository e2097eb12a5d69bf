package com.pos.checkout.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.pos.checkout.domain.LoyaltyProgram;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface LoyaltyProgramMapper extends BaseMapper<LoyaltyProgram> {
}
