package com.thermacore.scada.core.connection.pool;

import com.thermacore.scada.core.connection.ConnectionHandle;

/**
 * 设备连接例程，由协议层提供，必须可安全重试
 */
@FunctionalInterface
public interface DeviceConnector {

    ConnectionHandle connect(String deviceId) throws Exception;
}
