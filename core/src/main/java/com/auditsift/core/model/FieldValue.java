package com.auditsift.core.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 추출 필드 값: 문자열 | 정수 | null 중 하나.
 * 정규식 그룹은 항상 문자열이므로, 정수처럼 보이는 값만 NUMBER 로 승격한다.
 */
public final class FieldValue {

    public enum Kind { TEXT, NUMBER, NULL }

    private static final Pattern INTEGER = Pattern.compile("-?\\d{1,19}");
    private static final FieldValue NULL_VALUE = new FieldValue(Kind.NULL, null, 0L);

    private final Kind kind;
    private final String text;
    private final long number;

    private FieldValue(Kind kind, String text, long number) {
        this.kind = kind;
        this.text = text;
        this.number = number;
    }

    public static FieldValue text(String s) {
        return (s == null) ? NULL_VALUE : new FieldValue(Kind.TEXT, s, 0L);
    }

    public static FieldValue number(long n) {
        return new FieldValue(Kind.NUMBER, null, n);
    }

    public static FieldValue nullValue() { return NULL_VALUE; }

    /** 캡처 문자열 → 값. 정수 형태면 NUMBER, 아니면 TEXT, null 은 NULL. */
    public static FieldValue ofRaw(String raw) {
        if (raw == null) return NULL_VALUE;
        if (INTEGER.matcher(raw).matches()) {
            try {
                return number(Long.parseLong(raw));
            } catch (NumberFormatException overflow) {
                return text(raw);
            }
        }
        return text(raw);
    }

    public Kind kind() { return kind; }
    public boolean isText() { return kind == Kind.TEXT; }
    public boolean isNumber() { return kind == Kind.NUMBER; }
    public boolean isNull() { return kind == Kind.NULL; }

    public String asText() {
        if (kind != Kind.TEXT) throw new IllegalStateException("Not a text value: " + kind);
        return text;
    }

    public long asNumber() {
        if (kind != Kind.NUMBER) throw new IllegalStateException("Not a number value: " + kind);
        return number;
    }

    /** merge_fields 판정용: NULL 또는 공백 문자열 */
    public boolean isEmpty() {
        return kind == Kind.NULL || (kind == Kind.TEXT && text.isBlank());
    }

    /** 직렬화용 원시값 (String / Long / null) */
    public Object raw() {
        return switch (kind) {
            case TEXT -> text;
            case NUMBER -> number;
            case NULL -> null;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldValue other)) return false;
        return kind == other.kind && number == other.number && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() { return Objects.hash(kind, text, number); }

    @Override
    public String toString() { return String.valueOf(raw()); }
}
