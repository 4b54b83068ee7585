package com.sandy.aiot.vto.bridge.service;

import com.sandy.aiot.vto.bridge.vo.TopicSyncSummary;

/**
 * Aligns the topic catalogue of a cloud account with the visible devices.
 */
public interface RemoteTopicSync {
    TopicSyncSummary reconcileRemoteTopics(String accountKey);
}
