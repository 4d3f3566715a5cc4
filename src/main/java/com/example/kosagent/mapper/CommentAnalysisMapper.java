package com.example.kosagent.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.example.kosagent.entity.CommentAnalysis;
import org.apache.ibatis.annotations.Mapper;

/**
 * 评论诊断结果 Mapper
 */
@Mapper
public interface CommentAnalysisMapper extends BaseMapper<CommentAnalysis> {
}
