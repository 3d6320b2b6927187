package com.auditsift.core.model;

/** 덤프를 생성한 수집 스크립트 종류 */
public enum ProducerType {
    KPNIXAUDIT("KPNIXAUDIT", OsFamily.LINUX),
    KPWINAUDIT("KPWINAUDIT", OsFamily.WINDOWS),
    KPMACAUDIT("KPMACAUDIT", OsFamily.DARWIN),
    OTHER("Other", OsFamily.OTHER);

    private final String value;
    private final OsFamily osFamily;

    ProducerType(String value, OsFamily osFamily) {
        this.value = value;
        this.osFamily = osFamily;
    }

    public String value() { return value; }

    /** 수집기에서 유도되는 OS 계열 */
    public OsFamily osFamily() { return osFamily; }

    public static ProducerType fromValue(String s) {
        if (s != null) {
            String v = s.trim();
            for (ProducerType p : values()) {
                if (p.value.equalsIgnoreCase(v)) return p;
            }
        }
        throw new IllegalArgumentException("Unknown producer: " + s);
    }

    @Override public String toString() { return value; }
}
