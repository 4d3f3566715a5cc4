package com.example.kosagent.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.example.kosagent.entity.ContentDraftEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;

/**
 * 内容草稿 Mapper
 */
@Mapper
public interface ContentDraftMapper extends BaseMapper<ContentDraftEntity> {

    /**
     * 依赖 uk_user_strategy(user_id, strategy_id) 唯一索引实现幂等写入
     */
    @Insert("INSERT INTO content_draft (user_id, strategy_id, title, body, hashtags, quality_score, created_at, updated_at) " +
            "VALUES (#{userId}, #{strategyId}, #{title}, #{body}, #{hashtags}, #{qualityScore}, #{createdAt}, #{updatedAt}) " +
            "ON DUPLICATE KEY UPDATE title = VALUES(title), body = VALUES(body), hashtags = VALUES(hashtags), " +
            "quality_score = VALUES(quality_score), updated_at = VALUES(updated_at)")
    int upsert(ContentDraftEntity draft);
}
