package com.thermacore.scada.common.exception;

import com.thermacore.scada.common.domain.enums.Dnp3Quality;
import com.thermacore.scada.common.web.result.ResultCode;

/**
 * 点位写入异常
 */
public class WriteException extends DeviceOperationException {

    public WriteException(String message, String deviceId, String operation, Integer pointIndex) {
        super(ResultCode.WRITE_ERROR, message, deviceId, operation, pointIndex, Dnp3Quality.BAD);
    }

    public WriteException(String message, String deviceId, String operation, Integer pointIndex, Throwable cause) {
        super(ResultCode.WRITE_ERROR, message, deviceId, operation, pointIndex, Dnp3Quality.BAD, cause);
    }
}
