package com.thermacore.scada.core.protocol.dnp3;

import com.thermacore.scada.common.domain.enums.Dnp3DataType;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 模拟DNP3主站，不产生网络流量
 * <p>
 * 模拟量按索引段生成随机值：0-9 温度(20~80)，10-19 压力(0~150)，20-29 流量(0~100)，其余 0~1000。
 * 写入的输出值会被记住，再次读取输出点时返回写入值。
 */
@Slf4j
public class SimulatedDnp3Master implements Dnp3Master {

    private final Clock clock;
    private final AtomicLong sessionSequence = new AtomicLong();

    // deviceId:index -> 最近写入的输出值
    private final Map<String, Object> outputs = new ConcurrentHashMap<>();

    public SimulatedDnp3Master(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Dnp3Session connect(Dnp3Device device) {
        Dnp3Session session = new Dnp3Session(device, sessionSequence.incrementAndGet(), clock.instant());
        log.info("模拟主站已连接外站: {} ({}:{}, outstation={})",
                device.getDeviceId(), device.getHost(), device.getPort(), device.getOutstationAddress());
        return session;
    }

    @Override
    public Dnp3Reading readPoint(Dnp3Session session, Dnp3DataType dataType, int pointIndex) {
        requireOpen(session);
        return Dnp3Reading.builder()
                .index(pointIndex)
                .dataType(dataType)
                .value(simulateValue(session.getDeviceId(), dataType, pointIndex))
                .timestamp(clock.instant())
                .build();
    }

    @Override
    public List<Dnp3Reading> readRange(Dnp3Session session, Dnp3DataType dataType, int startIndex, int count) {
        requireOpen(session);
        List<Dnp3Reading> readings = new ArrayList<>(count);
        for (int offset = 0; offset < count; offset++) {
            readings.add(readPoint(session, dataType, startIndex + offset));
        }
        return readings;
    }

    @Override
    public boolean writeBinaryOutput(Dnp3Session session, int pointIndex, boolean value) {
        requireOpen(session);
        outputs.put(outputKey(session.getDeviceId(), pointIndex), value);
        log.info("模拟写入开关量输出: {}[{}] = {}", session.getDeviceId(), pointIndex, value);
        return true;
    }

    @Override
    public boolean writeAnalogOutput(Dnp3Session session, int pointIndex, double value) {
        requireOpen(session);
        outputs.put(outputKey(session.getDeviceId(), pointIndex), value);
        log.info("模拟写入模拟量输出: {}[{}] = {}", session.getDeviceId(), pointIndex, value);
        return true;
    }

    @Override
    public void integrityPoll(Dnp3Session session) {
        requireOpen(session);
        log.info("模拟完整性轮询: {}", session.getDeviceId());
    }

    private Object simulateValue(String deviceId, Dnp3DataType dataType, int pointIndex) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        switch (dataType) {
            case BINARY_INPUT:
                return random.nextBoolean();
            case BINARY_OUTPUT:
                return outputs.getOrDefault(outputKey(deviceId, pointIndex), Boolean.FALSE);
            case ANALOG_OUTPUT:
                return outputs.getOrDefault(outputKey(deviceId, pointIndex), 0.0);
            case COUNTER:
            case FROZEN_COUNTER:
                return random.nextLong(0, 1_000_001);
            case ANALOG_INPUT:
            default:
                return simulateAnalog(random, pointIndex);
        }
    }

    private static double simulateAnalog(ThreadLocalRandom random, int pointIndex) {
        if (pointIndex < 10) {
            return random.nextDouble(20.0, 80.0);
        }
        if (pointIndex < 20) {
            return random.nextDouble(0.0, 150.0);
        }
        if (pointIndex < 30) {
            return random.nextDouble(0.0, 100.0);
        }
        return random.nextDouble(0.0, 1000.0);
    }

    private static void requireOpen(Dnp3Session session) {
        if (session == null || !session.isOpen()) {
            throw new IllegalStateException("DNP3会话未打开: " + session);
        }
    }

    private static String outputKey(String deviceId, int pointIndex) {
        return deviceId + ":" + pointIndex;
    }
}
