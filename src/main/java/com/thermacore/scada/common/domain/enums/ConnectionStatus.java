package com.thermacore.scada.common.domain.enums;

import lombok.Getter;

/**
 * 设备连接状态
 */
@Getter
public enum ConnectionStatus {

    DISCONNECTED("DISCONNECTED", "已断开"),
    CONNECTED("CONNECTED", "已连接");

    private final String code;
    private final String description;

    ConnectionStatus(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public boolean isConnected() {
        return this == CONNECTED;
    }
}
