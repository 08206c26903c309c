package com.thermacore.scada.common.exception;

import com.thermacore.scada.common.domain.enums.Dnp3Quality;
import com.thermacore.scada.common.web.result.ResultCode;
import lombok.Getter;

/**
 * 设备操作异常基类，携带设备与操作上下文
 */
@Getter
public class DeviceOperationException extends BusinessException {

    private final String deviceId;
    private final String operation;
    private final Integer pointIndex;
    private final Dnp3Quality quality;

    public DeviceOperationException(ResultCode resultCode, String message, String deviceId,
                                    String operation, Integer pointIndex, Dnp3Quality quality) {
        super(resultCode, message);
        this.deviceId = deviceId;
        this.operation = operation;
        this.pointIndex = pointIndex;
        this.quality = quality;
    }

    public DeviceOperationException(ResultCode resultCode, String message, String deviceId,
                                    String operation, Integer pointIndex, Dnp3Quality quality,
                                    Throwable cause) {
        super(resultCode, message, cause);
        this.deviceId = deviceId;
        this.operation = operation;
        this.pointIndex = pointIndex;
        this.quality = quality;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        sb.append(" [device=").append(deviceId).append(", operation=").append(operation);
        if (pointIndex != null) {
            sb.append(", point=").append(pointIndex);
        }
        return sb.append(']').toString();
    }
}
