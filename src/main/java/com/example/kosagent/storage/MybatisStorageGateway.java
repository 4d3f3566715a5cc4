package com.example.kosagent.storage;

import com.example.kosagent.mapper.CommentAnalysisMapper;
import com.example.kosagent.mapper.ContentDraftMapper;
import com.example.kosagent.mapper.XhsCommentMapper;
import com.example.kosagent.mapper.XhsNoteMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 基于 MyBatis-Plus 的存储协作方
 */
@Service
@RequiredArgsConstructor
public class MybatisStorageGateway implements StorageGateway {

    private final CommentAnalysisMapper commentAnalysisMapper;
    private final XhsCommentMapper xhsCommentMapper;
    private final XhsNoteMapper xhsNoteMapper;
    private final ContentDraftMapper contentDraftMapper;

    @Override
    public StorageSession openSession() {
        return new MybatisStorageSession(commentAnalysisMapper, xhsCommentMapper, xhsNoteMapper, contentDraftMapper);
    }
}
