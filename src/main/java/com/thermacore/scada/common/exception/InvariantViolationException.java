package com.thermacore.scada.common.exception;

import com.thermacore.scada.common.domain.enums.Dnp3Quality;
import com.thermacore.scada.common.web.result.ResultCode;

/**
 * 内部一致性被破坏（缓存与设备索引不一致），直接失败，不返回可能错误的数据
 */
public class InvariantViolationException extends DeviceOperationException {

    public InvariantViolationException(String message, String deviceId, String operation, Integer pointIndex) {
        super(ResultCode.SYSTEM_ERROR, message, deviceId, operation, pointIndex, Dnp3Quality.BAD);
    }
}
