package com.thermacore.scada.common.exception;

import com.thermacore.scada.common.web.result.ResultCode;
import lombok.Getter;

/**
 * 容量耗尽异常，仅在关闭淘汰策略时出现
 */
@Getter
public class CapacityException extends DeviceOperationException {

    private final int capacity;

    public CapacityException(String message, String deviceId, String operation, int capacity) {
        super(ResultCode.CAPACITY_EXHAUSTED, message, deviceId, operation, null, null);
        this.capacity = capacity;
    }
}
