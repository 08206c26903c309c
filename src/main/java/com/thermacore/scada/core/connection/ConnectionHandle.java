package com.thermacore.scada.core.connection;

/**
 * 设备会话句柄，由连接池独占持有
 */
public interface ConnectionHandle {

    /**
     * 所属设备
     */
    String getDeviceId();

    /**
     * 底层会话是否仍可用
     */
    boolean isOpen();

    /**
     * 关闭底层会话
     */
    void close() throws Exception;
}
