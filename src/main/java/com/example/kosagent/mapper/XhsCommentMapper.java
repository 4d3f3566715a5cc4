package com.example.kosagent.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.example.kosagent.entity.UserCommentStats;
import com.example.kosagent.entity.XhsComment;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.Collection;
import java.util.List;

/**
 * 评论 Mapper - 附带按用户聚合的互动统计
 */
@Mapper
public interface XhsCommentMapper extends BaseMapper<XhsComment> {

    /**
     * 统计一批用户的评论数、参与笔记数与最近评论时间
     */
    @Select("<script>" +
            "SELECT comment_user_id AS userId, COUNT(*) AS interactionCount, " +
            "COUNT(DISTINCT note_id) AS notesEngaged, MAX(comment_create_time) AS lastActivityAt " +
            "FROM xhs_comments WHERE comment_user_id IN " +
            "<foreach collection='userIds' item='uid' open='(' separator=',' close=')'>#{uid}</foreach> " +
            "GROUP BY comment_user_id" +
            "</script>")
    List<UserCommentStats> statsByUserIds(@Param("userIds") Collection<String> userIds);
}
