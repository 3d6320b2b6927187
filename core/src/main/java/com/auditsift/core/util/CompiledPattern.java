package com.auditsift.core.util;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 컴파일된 검색 정규식 + 원래 그룹 이름(선언 순서)과 Java 용 별칭 매핑.
 */
public final class CompiledPattern {
    private final String source;
    private final Pattern pattern;
    private final List<String> groupNames;
    private final Map<String, String> aliases;   // 원래 이름 → Java 그룹명

    CompiledPattern(String source, Pattern pattern, List<String> groupNames, Map<String, String> aliases) {
        this.source = Objects.requireNonNull(source, "source");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.groupNames = List.copyOf(groupNames);
        this.aliases = Map.copyOf(aliases);
    }

    /** YAML 에 적힌 원문 */
    public String source() { return source; }

    public Pattern pattern() { return pattern; }

    /** 이름 있는 그룹들 (패턴 내 선언 순서) */
    public List<String> groupNames() { return groupNames; }

    public boolean hasGroup(String name) { return aliases.containsKey(name); }

    public Matcher matcher(CharSequence input) { return pattern.matcher(input); }

    /** 매칭된 그룹 값. 그룹이 없거나 참여하지 않았으면 null. */
    public String group(Matcher m, String name) {
        String alias = aliases.get(name);
        return (alias == null) ? null : m.group(alias);
    }

    @Override
    public String toString() { return source; }
}
