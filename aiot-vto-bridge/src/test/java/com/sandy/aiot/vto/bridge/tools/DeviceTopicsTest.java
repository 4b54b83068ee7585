package com.sandy.aiot.vto.bridge.tools;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DeviceTopicsTest {

    @Test
    void topicIsAddressWithoutSeparators() {
        assertEquals("vto172161101006", DeviceTopics.deriveTopic("172.16.110.1"));
        assertEquals("vto17216111006", DeviceTopics.deriveTopic("172.16.11.1"));
        assertEquals("vto192168180006", DeviceTopics.deriveTopic(" 192.168.1.80 "));
        assertEquals("vtofe801006", DeviceTopics.deriveTopic("fe80::1"));
    }

    @Test
    void blankAddressHasNoTopic() {
        assertNull(DeviceTopics.deriveTopic(null));
        assertNull(DeviceTopics.deriveTopic("  "));
    }

    @Test
    void recognisesDeviceTopics() {
        assertTrue(DeviceTopics.isDeviceTopic("vto172161101006"));
        assertFalse(DeviceTopics.isDeviceTopic("light002"));
        assertFalse(DeviceTopics.isDeviceTopic(null));
    }
}
