package com.auditsift.core.model;

/** 리눅스 배포판 패키지 계열 (Linux 시스템에만 존재) */
public enum DistroFamily {
    DEB("deb"),
    RPM("rpm"),
    APK("apk"),
    OTHER("other");

    private final String value;

    DistroFamily(String value) { this.value = value; }

    public String value() { return value; }

    public static DistroFamily fromValue(String s) {
        if (s != null) {
            String v = s.trim();
            for (DistroFamily d : values()) {
                if (d.value.equalsIgnoreCase(v)) return d;
            }
        }
        throw new IllegalArgumentException("Unknown distro_family: " + s);
    }

    @Override public String toString() { return value; }
}
