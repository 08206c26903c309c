package com.thermacore.scada.core.protocol.dnp3;

import com.thermacore.scada.common.domain.enums.ConnectionStatus;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 设备运行时状态
 * <p>
 * epoch 在每次断开时递增，用于识别断开前发起、断开后才完成的读取。
 */
@Getter
@Setter
class Dnp3DeviceContext {

    private final Dnp3Device device;
    private volatile List<Dnp3DataPoint> dataPoints = List.of();
    private volatile ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private volatile int lastReadingCount;
    private volatile Instant lastReadAt;
    private volatile Instant lastPollAt;
    private final AtomicLong epoch = new AtomicLong();

    Dnp3DeviceContext(Dnp3Device device) {
        this.device = device;
    }

    String getDeviceId() {
        return device.getDeviceId();
    }

    boolean isConnected() {
        return status.isConnected();
    }

    long currentEpoch() {
        return epoch.get();
    }

    long nextEpoch() {
        return epoch.incrementAndGet();
    }

    Optional<Dnp3DataPoint> findPoint(int pointIndex) {
        for (Dnp3DataPoint point : dataPoints) {
            if (point.getIndex() == pointIndex) {
                return Optional.of(point);
            }
        }
        return Optional.empty();
    }
}
