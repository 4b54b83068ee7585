package com.sandy.aiot.vto.bridge.service.impl;

import com.sandy.aiot.vto.bridge.entity.BemfaAccount;
import com.sandy.aiot.vto.bridge.service.DeviceRegistry;
import com.sandy.aiot.vto.bridge.service.RemoteTopicSync;
import com.sandy.aiot.vto.bridge.vo.TopicSyncSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Topic catalogue management lives in the Bemfa console; the bridge only reports what
 * it would have to align there.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LoggingRemoteTopicSync implements RemoteTopicSync {

    private final DeviceRegistry deviceRegistry;

    @Override
    public TopicSyncSummary reconcileRemoteTopics(String accountKey) {
        int visible = deviceRegistry.listVisibleDevices().size();
        log.info("Remote topic sync requested [account={}; visibleDevices={}], catalogue left unchanged",
                BemfaAccount.maskKey(accountKey), visible);
        return TopicSyncSummary.empty();
    }
}
