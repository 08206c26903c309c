package com.thermacore.scada.core.cache;

import java.util.Objects;

/**
 * 缓存键：设备 + 点位索引
 */
public record PointKey(String deviceId, int pointIndex) {

    public PointKey {
        Objects.requireNonNull(deviceId, "deviceId");
    }

    @Override
    public String toString() {
        return deviceId + ":" + pointIndex;
    }
}
