package com.thermacore.scada.core.protocol.dnp3;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 设备全量读取结果
 */
@Data
@Builder
public class DeviceReadResult {

    private final String deviceId;
    private final int outstationAddress;
    private final Instant timestamp;

    // key: sensorType_index
    @Builder.Default
    private final Map<String, Dnp3Reading> readings = new LinkedHashMap<>();

    private final int totalPoints;
    // 命中缓存的点位数
    private final int cachedPoints;
}
