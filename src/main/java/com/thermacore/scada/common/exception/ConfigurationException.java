package com.thermacore.scada.common.exception;

import com.thermacore.scada.common.web.result.ResultCode;
import lombok.Getter;

/**
 * 配置异常，启动阶段抛出，不做恢复
 */
@Getter
public class ConfigurationException extends BusinessException {

    private final String property;

    public ConfigurationException(String property, String message) {
        super(ResultCode.CONFIG_INVALID, message);
        this.property = property;
    }

    /**
     * 校验数值必须为正
     */
    public static void requirePositive(String property, double value) {
        if (!(value > 0)) {
            throw new ConfigurationException(property,
                    String.format("配置项 %s 必须大于0，当前值: %s", property, value));
        }
    }
}
