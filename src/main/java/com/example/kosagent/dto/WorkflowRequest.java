package com.example.kosagent.dto;

import com.example.kosagent.storage.UserCriteria;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 工作流提交请求
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowRequest {

    /**
     * 任务描述，例如："为露营地找出高价值用户并生成种草文案"
     */
    @NotBlank
    private String task;

    /**
     * 用户筛选条件，缺省时使用默认条件
     */
    private UserCriteria criteria;

    /**
     * 是否启用 AI 增强（任务分析、语义洞察、检索佐证）
     */
    private boolean aiEnhanced;

    @Builder.Default
    private List<String> businessGoals = new ArrayList<>();

    /**
     * 运行截止时间（秒），缺省使用 kos.workflow.default-deadline-seconds
     */
    @Positive
    private Integer deadlineSeconds;
}
