package com.thermacore.scada.common.web.result;

/**
 * 响应码枚举
 */
public enum ResultCode {

    // 成功
    SUCCESS(200, "成功"),

    // 客户端错误
    NOT_FOUND(404, "资源不存在"),
    PARAM_ERROR(1000, "参数错误"),

    // 设备通信相关错误
    CONNECTION_ERROR(2001, "设备连接错误"),
    COLLECTION_ERROR(2004, "设备读取错误"),
    WRITE_ERROR(2007, "设备写入错误"),
    CAPACITY_EXHAUSTED(2008, "资源容量已满"),

    // 配置相关错误
    CONFIG_INVALID(3002, "配置无效"),

    // 系统错误
    SYSTEM_ERROR(5000, "系统内部错误");

    private final int code;
    private final String message;

    ResultCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    // 根据code获取枚举
    public static ResultCode fromCode(int code) {
        for (ResultCode resultCode : values()) {
            if (resultCode.getCode() == code) {
                return resultCode;
            }
        }
        return SYSTEM_ERROR;
    }
}
