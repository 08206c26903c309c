package com.thermacore.scada.core.protocol.dnp3;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * DNP3 外站设备配置
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Dnp3Device {

    /** 设备唯一标识 */
    private String deviceId;

    /** 主站链路地址 */
    private int masterAddress;

    /** 外站链路地址 */
    private int outstationAddress;

    private String host;

    @Builder.Default
    private int port = 20000;

    /** 链路层超时 */
    @Builder.Default
    private Duration linkTimeout = Duration.ofSeconds(5);

    /** 应用层超时，为空时使用全局读取超时 */
    private Duration appTimeout;
}
