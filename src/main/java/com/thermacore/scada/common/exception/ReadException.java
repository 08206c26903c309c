package com.thermacore.scada.common.exception;

import com.thermacore.scada.common.domain.enums.Dnp3Quality;
import com.thermacore.scada.common.web.result.ResultCode;

/**
 * 点位读取异常，设备状态保持不变
 */
public class ReadException extends DeviceOperationException {

    public ReadException(String message, String deviceId, String operation, Integer pointIndex,
                         Dnp3Quality quality, Throwable cause) {
        super(ResultCode.COLLECTION_ERROR, message, deviceId, operation, pointIndex, quality, cause);
    }

    // 读取超时
    public static ReadException timeout(String deviceId, String operation, Integer pointIndex, long timeoutMs) {
        return new ReadException("读取超时(" + timeoutMs + "ms)", deviceId, operation, pointIndex,
                Dnp3Quality.STALE, null);
    }

    // 协议读取失败
    public static ReadException ioFailure(String deviceId, String operation, Integer pointIndex, Throwable cause) {
        return new ReadException("协议读取失败", deviceId, operation, pointIndex, Dnp3Quality.BAD, cause);
    }
}
