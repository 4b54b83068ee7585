package com.sandy.aiot.vto.bridge.vo;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TopicSyncSummary {
    private int created;
    private int updated;
    private int deleted;
    private int failed;

    public boolean hasChanges() {
        return created > 0 || updated > 0 || deleted > 0;
    }

    public static TopicSyncSummary empty() {
        return TopicSyncSummary.builder().build();
    }
}
