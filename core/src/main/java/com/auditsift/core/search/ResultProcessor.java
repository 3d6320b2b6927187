package com.auditsift.core.search;

import com.auditsift.core.model.SearchResult;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/** 결과 후처리: 제어문자 제거, (시스템, 매칭 텍스트) 기준 중복 제거 */
public final class ResultProcessor {

    /** 0x00–0x08, 0x0B, 0x0C, 0x0E–0x1F (탭/개행/CR 은 유지) */
    private static final Pattern ILLEGAL = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F]");

    private ResultProcessor() {}

    public static String sanitize(String s) {
        if (s == null || s.isEmpty()) return s;
        return ILLEGAL.matcher(s).replaceAll("");
    }

    private record Key(String systemName, String text) {}

    /** 처음 나온 것만 남기고 순서 유지 */
    public static List<SearchResult> dedupe(List<SearchResult> results) {
        Set<Key> seen = new HashSet<>();
        List<SearchResult> out = new ArrayList<>(results.size());
        for (SearchResult r : results) {
            if (seen.add(new Key(r.getSystemName(), r.getMatchedText().strip()))) out.add(r);
        }
        return out;
    }
}
