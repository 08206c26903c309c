package com.thermacore.scada.common.exception;

import com.thermacore.scada.common.domain.enums.Dnp3Quality;
import com.thermacore.scada.common.web.result.ResultCode;

/**
 * 设备连接异常，设备保持断开状态，由调用方决定重试策略
 */
public class ConnectionException extends DeviceOperationException {

    public ConnectionException(String message, String deviceId, String operation) {
        super(ResultCode.CONNECTION_ERROR, message, deviceId, operation, null, Dnp3Quality.COMM_LOST);
    }

    public ConnectionException(String message, String deviceId, String operation, Throwable cause) {
        super(ResultCode.CONNECTION_ERROR, message, deviceId, operation, null, Dnp3Quality.COMM_LOST, cause);
    }

    private ConnectionException(ResultCode resultCode, String message, String deviceId, String operation) {
        super(resultCode, message, deviceId, operation, null, null);
    }

    // 设备未连接
    public static ConnectionException notConnected(String deviceId, String operation) {
        return new ConnectionException("设备未连接", deviceId, operation);
    }

    // 设备未配置
    public static ConnectionException notConfigured(String deviceId, String operation) {
        return new ConnectionException(ResultCode.NOT_FOUND, "设备未配置", deviceId, operation);
    }
}
