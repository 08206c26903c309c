package com.thermacore.scada.core.protocol.dnp3;

import com.thermacore.scada.common.domain.enums.Dnp3DataType;
import com.thermacore.scada.common.domain.enums.Dnp3Quality;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * 点位读数，创建后不再修改
 */
@Data
@Builder(toBuilder = true)
public class Dnp3Reading {

    private final int index;
    private final Dnp3DataType dataType;
    // Boolean、Double 或 Long
    private final Object value;
    @Builder.Default
    private final Dnp3Quality quality = Dnp3Quality.GOOD;
    private final Instant timestamp;
    private final String sensorType;
    private final String description;
    private final String unit;
}
