package com.sandy.aiot.vto.bridge.service;

import com.sandy.aiot.vto.bridge.entity.VtoDevice;
import com.sandy.aiot.vto.bridge.vo.DoorOpenResult;

public interface DoorActuationService {
    /**
     * Runs the full login / open / logout flow against the unit of the device.
     */
    DoorOpenResult open(VtoDevice device);
}
