package com.thermacore.scada.common.domain.enums;

/**
 * DNP3 数据质量标志
 */
public enum Dnp3Quality {

    GOOD("good", "良好"),
    BAD("bad", "不良"),
    STALE("stale", "陈旧"),
    COMM_LOST("comm_lost", "通信中断"),
    LOCAL_FORCE("local_force", "本地强制"),
    REMOTE_FORCE("remote_force", "远程强制"),
    OVER_RANGE("over_range", "超量程"),
    REFERENCE_ERR("reference_err", "参考错误");

    private final String code;
    private final String description;

    Dnp3Quality(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }
}
