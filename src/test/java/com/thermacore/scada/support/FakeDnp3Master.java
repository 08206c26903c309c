package com.thermacore.scada.support;

import com.google.common.util.concurrent.Uninterruptibles;
import com.thermacore.scada.common.domain.enums.Dnp3DataType;
import com.thermacore.scada.core.protocol.dnp3.Dnp3Device;
import com.thermacore.scada.core.protocol.dnp3.Dnp3Master;
import com.thermacore.scada.core.protocol.dnp3.Dnp3Reading;
import com.thermacore.scada.core.protocol.dnp3.Dnp3Session;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 可控的DNP3主站：记录调用次数，读数默认为 index * 10
 */
public class FakeDnp3Master implements Dnp3Master {

    private final Clock clock;
    private final AtomicInteger sessionSequence = new AtomicInteger();

    public final AtomicInteger connectCalls = new AtomicInteger();
    public final AtomicInteger readPointCalls = new AtomicInteger();
    public final AtomicInteger readRangeCalls = new AtomicInteger();
    public final AtomicInteger writeCalls = new AtomicInteger();
    public final AtomicInteger pollCalls = new AtomicInteger();
    public final List<Dnp3Session> sessions = new CopyOnWriteArrayList<>();

    private final Map<Integer, Object> values = new ConcurrentHashMap<>();
    private volatile boolean failConnect;
    private volatile long connectDelayMs;
    private volatile boolean failRead;
    private volatile boolean rejectWrites;
    private volatile CountDownLatch readGate;
    private volatile CountDownLatch readStarted;

    public FakeDnp3Master(Clock clock) {
        this.clock = clock;
    }

    public void setValue(int index, Object value) {
        values.put(index, value);
    }

    public void setFailConnect(boolean failConnect) {
        this.failConnect = failConnect;
    }

    /**
     * 建立连接前等待，不响应中断
     */
    public void setConnectDelayMs(long connectDelayMs) {
        this.connectDelayMs = connectDelayMs;
    }

    public void setFailRead(boolean failRead) {
        this.failRead = failRead;
    }

    public void setRejectWrites(boolean rejectWrites) {
        this.rejectWrites = rejectWrites;
    }

    /**
     * 之后的读取阻塞到 gate 打开为止，started 在读取开始时计数
     */
    public void blockReads(CountDownLatch gate, CountDownLatch started) {
        this.readGate = gate;
        this.readStarted = started;
    }

    @Override
    public synchronized Dnp3Session connect(Dnp3Device device) throws IOException {
        connectCalls.incrementAndGet();
        if (failConnect) {
            throw new IOException("connection refused: " + device.getHost());
        }
        if (connectDelayMs > 0) {
            Uninterruptibles.sleepUninterruptibly(connectDelayMs, TimeUnit.MILLISECONDS);
        }
        Dnp3Session session = new Dnp3Session(device, sessionSequence.incrementAndGet(), clock.instant());
        sessions.add(session);
        return session;
    }

    @Override
    public Dnp3Reading readPoint(Dnp3Session session, Dnp3DataType dataType, int pointIndex) throws Exception {
        readPointCalls.incrementAndGet();
        awaitGate();
        return reading(dataType, pointIndex);
    }

    @Override
    public List<Dnp3Reading> readRange(Dnp3Session session, Dnp3DataType dataType, int startIndex, int count)
            throws Exception {
        readRangeCalls.incrementAndGet();
        awaitGate();
        List<Dnp3Reading> readings = new ArrayList<>();
        for (int offset = 0; offset < count; offset++) {
            readings.add(reading(dataType, startIndex + offset));
        }
        return readings;
    }

    @Override
    public boolean writeBinaryOutput(Dnp3Session session, int pointIndex, boolean value) {
        writeCalls.incrementAndGet();
        if (!rejectWrites) {
            values.put(pointIndex, value);
        }
        return !rejectWrites;
    }

    @Override
    public boolean writeAnalogOutput(Dnp3Session session, int pointIndex, double value) {
        writeCalls.incrementAndGet();
        if (!rejectWrites) {
            values.put(pointIndex, value);
        }
        return !rejectWrites;
    }

    @Override
    public void integrityPoll(Dnp3Session session) {
        pollCalls.incrementAndGet();
    }

    private void awaitGate() throws Exception {
        CountDownLatch started = readStarted;
        if (started != null) {
            started.countDown();
        }
        CountDownLatch gate = readGate;
        if (gate != null) {
            gate.await();
        }
        if (failRead) {
            throw new IOException("read failed");
        }
    }

    private Dnp3Reading reading(Dnp3DataType dataType, int index) {
        return Dnp3Reading.builder()
                .index(index)
                .dataType(dataType)
                .value(values.getOrDefault(index, index * 10.0))
                .timestamp(clock.instant())
                .build();
    }
}
