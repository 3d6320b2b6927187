package com.auditsift.core.filter;

import java.util.Arrays;
import java.util.OptionalInt;

/**
 * 점(.) 구분 정수 버전 비교. "0.4.7" vs "0.4.10" 처럼 사전식으로는 틀리는 경우를 위해 쓴다.
 * 부족한 뒷자리는 0 으로 채우고 최소 3자리로 맞춘다.
 */
public final class VersionComparator {

    private static final int MIN_COMPONENTS = 3;

    private VersionComparator() {}

    /** 정수 성분 배열. 숫자가 아닌 성분이 있으면 null. */
    static long[] parse(String version) {
        if (version == null) return null;
        String v = version.trim();
        if (v.isEmpty()) return null;
        String[] parts = v.split("\\.", -1);
        long[] out = new long[parts.length];
        for (int i = 0; i < parts.length; i++) {
            String p = parts[i];
            if (p.isEmpty()) return null;
            for (int k = 0; k < p.length(); k++) {
                if (!Character.isDigit(p.charAt(k))) return null;
            }
            try {
                out[i] = Long.parseLong(p);
            } catch (NumberFormatException overflow) {
                return null;
            }
        }
        return out;
    }

    /**
     * 두 버전 비교. 어느 한쪽이라도 버전 형식이 아니면 empty (호출 측이 문자열 비교로 대체).
     */
    public static OptionalInt compare(String left, String right) {
        long[] a = parse(left);
        long[] b = parse(right);
        if (a == null || b == null) return OptionalInt.empty();

        int len = Math.max(MIN_COMPONENTS, Math.max(a.length, b.length));
        a = Arrays.copyOf(a, len);
        b = Arrays.copyOf(b, len);
        for (int i = 0; i < len; i++) {
            int c = Long.compare(a[i], b[i]);
            if (c != 0) return OptionalInt.of(c);
        }
        return OptionalInt.of(0);
    }

    public static boolean isVersion(String s) {
        return parse(s) != null;
    }
}
