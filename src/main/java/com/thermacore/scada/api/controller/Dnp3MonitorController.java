package com.thermacore.scada.api.controller;

import com.thermacore.scada.core.protocol.dnp3.Dnp3Service;
import com.thermacore.scada.monitor.metrics.Dnp3PerformanceSnapshot;
import com.thermacore.scada.monitor.metrics.Dnp3PerformanceSummary;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * DNP3 监控接口（只读）
 */
@RestController
@RequestMapping("/monitor/dnp3")
@RequiredArgsConstructor
public class Dnp3MonitorController {

    private final Dnp3Service dnp3Service;

    @GetMapping("/metrics")
    public Dnp3PerformanceSnapshot metrics() {
        return dnp3Service.getPerformanceMetrics();
    }

    @GetMapping("/summary")
    public Dnp3PerformanceSummary summary() {
        return dnp3Service.getPerformanceSummary();
    }

    @GetMapping("/status")
    public Map<String, Object> serviceStatus() {
        return dnp3Service.getServiceStatus();
    }

    @GetMapping("/devices/{deviceId}")
    public Map<String, Object> deviceStatus(@PathVariable String deviceId) {
        return dnp3Service.getDeviceStatus(deviceId);
    }

    @GetMapping("/devices/{deviceId}/performance")
    public Map<String, Object> devicePerformance(@PathVariable String deviceId) {
        return dnp3Service.getDevicePerformanceStats(deviceId);
    }
}
