package com.sandy.aiot.vto.bridge.tools;

/**
 * Utility class for deriving Bemfa command topics from door station addresses.
 */
public final class DeviceTopics {

    public static final String PREFIX = "vto";
    /** Bemfa treats topics ending in 006 as switch/lock devices. */
    public static final String SUFFIX = "006";

    private DeviceTopics() {
    }

    /**
     * Derives the command topic of a door station.
     *
     * @param address The network address of the unit, e.g., "172.16.11.1"
     * @return "vto" + address without separators + "006", e.g., "vto17216111006". Returns null for a blank address.
     */
    public static String deriveTopic(String address) {
        if (address == null || address.isBlank()) {
            return null;
        }
        String clean = address.trim().replace(".", "").replace(":", "");
        return PREFIX + clean + SUFFIX;
    }

    public static boolean isDeviceTopic(String topic) {
        return topic != null && topic.startsWith(PREFIX) && topic.endsWith(SUFFIX);
    }
}
