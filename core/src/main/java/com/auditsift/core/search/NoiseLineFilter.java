package com.auditsift.core.search;

import java.util.List;

/** 수집 스크립트가 남기는 구분/진행 표시 줄 */
final class NoiseLineFilter {

    static final List<String> MARKERS = List.of(
            "###[BEGIN]",
            "###Processing Command:",
            "###Running:",
            "###[END]");

    private static final String HASH_RUN = "###";

    private NoiseLineFilter() {}

    static boolean isNoise(String line) {
        for (String marker : MARKERS) {
            if (line.contains(marker)) return true;
        }
        return line.contains(HASH_RUN);
    }
}
