package com.thermacore.scada.common.exception;

import com.thermacore.scada.common.web.result.ApiResult;
import com.thermacore.scada.common.web.result.ResultCode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常处理器
 * <p>
 * 只返回通用错误信息，设备上下文放在 extra 中。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理设备操作异常
     */
    @ExceptionHandler(DeviceOperationException.class)
    public ApiResult<?> handleDeviceOperationException(DeviceOperationException e, HttpServletRequest request) {
        log.error("设备操作异常 - Device: {}, Operation: {}, Quality: {}",
                e.getDeviceId(), e.getOperation(), e.getQuality(), e);

        ApiResult<Object> result = ApiResult.error(ResultCode.fromCode(e.getCode()));
        result.addExtra("deviceId", e.getDeviceId());
        result.addExtra("operation", e.getOperation());
        result.addExtra("pointIndex", e.getPointIndex());
        if (e.getQuality() != null) {
            result.addExtra("quality", e.getQuality().getCode());
        }
        return result;
    }

    /**
     * 处理业务异常
     */
    @ExceptionHandler(BusinessException.class)
    public ApiResult<?> handleBusinessException(BusinessException e, HttpServletRequest request) {
        log.error("业务异常: {} - {}", e.getCode(), e.getMessage(), e);
        return ApiResult.error(e.getCode(), e.getMessage());
    }

    /**
     * 处理参数异常
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ApiResult<?> handleIllegalArgumentException(IllegalArgumentException e, HttpServletRequest request) {
        log.error("参数异常: {}", e.getMessage());
        return ApiResult.error(ResultCode.PARAM_ERROR.getCode(), e.getMessage());
    }

    /**
     * 处理其他异常
     */
    @ExceptionHandler(Exception.class)
    public ApiResult<?> handleException(Exception e, HttpServletRequest request) {
        log.error("系统异常: {}", request.getRequestURI(), e);
        return ApiResult.error(ResultCode.SYSTEM_ERROR);
    }
}
