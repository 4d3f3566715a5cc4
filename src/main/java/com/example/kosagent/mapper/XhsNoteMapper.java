package com.example.kosagent.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.example.kosagent.entity.XhsNote;
import org.apache.ibatis.annotations.Mapper;

/**
 * 笔记 Mapper
 */
@Mapper
public interface XhsNoteMapper extends BaseMapper<XhsNote> {
}
