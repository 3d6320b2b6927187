package com.auditsift.core.model;

import java.util.Locale;

/** 감사 대상 시스템의 OS 계열 */
public enum OsFamily {
    WINDOWS("Windows"),
    LINUX("Linux"),
    DARWIN("Darwin"),
    OTHER("Other"),
    UNDEFINED("Undefined");

    private final String value;

    OsFamily(String value) { this.value = value; }

    /** YAML/리포트에 쓰이는 표기 */
    public String value() { return value; }

    /** 대소문자 무시 파싱(파싱 경계에서만 사용) */
    public static OsFamily fromValue(String s) {
        if (s != null) {
            String v = s.trim();
            for (OsFamily f : values()) {
                if (f.value.equalsIgnoreCase(v) || f.name().equalsIgnoreCase(v)) return f;
            }
        }
        throw new IllegalArgumentException("Unknown os_family: " + s);
    }

    /** 출력 디렉토리 등에 쓰는 소문자 슬러그 */
    public String slug() { return value.toLowerCase(Locale.ROOT); }

    @Override public String toString() { return value; }
}
