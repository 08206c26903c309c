package com.thermacore.scada.core.protocol.dnp3;

import com.thermacore.scada.common.domain.enums.Dnp3DataType;

import java.util.List;

/**
 * DNP3 主站协议接口
 * <p>
 * 实现可能阻塞，调用方负责超时控制。
 */
public interface Dnp3Master {

    /**
     * 与外站建立会话
     */
    Dnp3Session connect(Dnp3Device device) throws Exception;

    /**
     * 读取单个点位
     */
    Dnp3Reading readPoint(Dnp3Session session, Dnp3DataType dataType, int pointIndex) throws Exception;

    /**
     * 批量读取同类型的连续点位 [startIndex, startIndex + count)
     */
    List<Dnp3Reading> readRange(Dnp3Session session, Dnp3DataType dataType, int startIndex, int count) throws Exception;

    boolean writeBinaryOutput(Dnp3Session session, int pointIndex, boolean value) throws Exception;

    boolean writeAnalogOutput(Dnp3Session session, int pointIndex, double value) throws Exception;

    /**
     * 完整性轮询（Class 0/1/2/3）
     */
    void integrityPoll(Dnp3Session session) throws Exception;
}
