package com.pos.checkout.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.pos.checkout.domain.ReconciliationQueueItem;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface ReconciliationQueueMapper extends BaseMapper<ReconciliationQueueItem> {
}
