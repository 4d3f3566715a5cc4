package com.example.kosagent.scoring;

import com.example.kosagent.storage.UserRecord;
import lombok.Value;

/**
 * 排序后的候选用户
 */
@Value
public class RankedUser {

    int rank;

    UserRecord user;

    ValueScore score;

    public String getUserId() {
        return user.getUserId();
    }
}
