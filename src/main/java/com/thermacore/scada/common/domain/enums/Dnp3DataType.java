package com.thermacore.scada.common.domain.enums;

import lombok.Getter;

/**
 * DNP3 点位类型
 */
@Getter
public enum Dnp3DataType {

    BINARY_INPUT("binary_input", false),
    BINARY_OUTPUT("binary_output", true),
    ANALOG_INPUT("analog_input", false),
    ANALOG_OUTPUT("analog_output", true),
    COUNTER("counter", false),
    FROZEN_COUNTER("frozen_counter", false);

    private final String code;
    private final boolean writable;

    Dnp3DataType(String code, boolean writable) {
        this.code = code;
        this.writable = writable;
    }
}
