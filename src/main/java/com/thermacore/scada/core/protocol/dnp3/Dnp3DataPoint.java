package com.thermacore.scada.core.protocol.dnp3;

import com.thermacore.scada.common.domain.enums.Dnp3DataType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DNP3 点位配置
 * <p>
 * 模拟量输入按 value * scaleFactor + offset 换算为工程值。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Dnp3DataPoint {

    /** 点位索引 */
    private int index;

    private Dnp3DataType dataType;

    private String description;

    /** 传感器类型，如 temperature、pressure */
    @Builder.Default
    private String sensorType = "generic";

    @Builder.Default
    private double scaleFactor = 1.0;

    @Builder.Default
    private double offset = 0.0;

    /** 工程单位，如 °C、kPa */
    private String unit;

    public boolean isScaled() {
        return dataType == Dnp3DataType.ANALOG_INPUT && (scaleFactor != 1.0 || offset != 0.0);
    }

    public double toEngineeringValue(double rawValue) {
        return rawValue * scaleFactor + offset;
    }
}
