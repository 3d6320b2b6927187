package com.auditsift.core.model;

/**
 * sys_filter 에서 참조할 수 있는 시스템 속성.
 * 일부 속성은 특정 OS 계열에서만 의미가 있고, 그 외 계열에서는 필터를 통과시킨다.
 */
public enum FilterAttribute {
    OS_FAMILY("os_family", null, false),
    DISTRO_FAMILY("distro_family", OsFamily.LINUX, false),
    PRODUCER("producer", null, false),
    PRODUCER_VERSION("producer_version", null, true),
    PRODUCT_NAME("product_name", OsFamily.WINDOWS, false),
    RELEASE_ID("release_id", OsFamily.WINDOWS, false),
    CURRENT_BUILD("current_build", OsFamily.WINDOWS, true),
    UBR("ubr", OsFamily.WINDOWS, true),
    OS_PRETTY_NAME("os_pretty_name", OsFamily.LINUX, false),
    OS_VERSION("os_version", OsFamily.LINUX, false);

    private final String value;
    private final OsFamily onlyFor;   // null = 모든 계열
    private final boolean versionLike;

    FilterAttribute(String value, OsFamily onlyFor, boolean versionLike) {
        this.value = value;
        this.onlyFor = onlyFor;
        this.versionLike = versionLike;
    }

    public String value() { return value; }

    /** 점 구분 버전 비교 대상 여부 */
    public boolean isVersionLike() { return versionLike; }

    /** enum 으로 정규화되는 속성(os_family/distro_family/producer) */
    public boolean isEnumBacked() {
        return this == OS_FAMILY || this == DISTRO_FAMILY || this == PRODUCER;
    }

    public boolean isApplicableTo(OsFamily family) {
        return onlyFor == null || onlyFor == family;
    }

    public static FilterAttribute fromValue(String s) {
        if (s != null) {
            String v = s.trim();
            for (FilterAttribute a : values()) {
                if (a.value.equalsIgnoreCase(v)) return a;
            }
        }
        throw new IllegalArgumentException("Unknown filter attribute: " + s);
    }

    @Override public String toString() { return value; }
}
