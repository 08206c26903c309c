package com.thermacore.scada.core.protocol.dnp3;

import com.thermacore.scada.core.connection.ConnectionHandle;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 主站与单个外站之间的会话
 */
@Slf4j
public class Dnp3Session implements ConnectionHandle {

    @Getter
    private final Dnp3Device device;
    @Getter
    private final long sessionId;
    @Getter
    private final Instant openedAt;
    private final AtomicBoolean open = new AtomicBoolean(true);

    public Dnp3Session(Dnp3Device device, long sessionId, Instant openedAt) {
        this.device = device;
        this.sessionId = sessionId;
        this.openedAt = openedAt;
    }

    @Override
    public String getDeviceId() {
        return device.getDeviceId();
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    @Override
    public void close() {
        if (open.compareAndSet(true, false)) {
            log.debug("DNP3会话已关闭: {}#{}", getDeviceId(), sessionId);
        }
    }

    @Override
    public String toString() {
        return "Dnp3Session{" + getDeviceId() + "#" + sessionId + ", open=" + open.get() + "}";
    }
}
