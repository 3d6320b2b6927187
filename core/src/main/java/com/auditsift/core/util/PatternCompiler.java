package com.auditsift.core.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 설정 파일의 정규식을 java.util.regex 로 컴파일한다.
 *
 * 검색 설정은 {@code (?P<name>...)} / {@code (?P=name)} 표기를 쓰고, 그룹 이름에 '_' 가 들어간다.
 * Java 그룹명은 영숫자만 허용하므로 모든 이름 있는 그룹을 {@code g1, g2, ...} 별칭으로 바꾸고
 * 원래 이름은 {@link CompiledPattern} 에 남긴다. {@code (?<name>...)} 와 {@code \k<name>} 도 그대로 받는다.
 */
public final class PatternCompiler {

    private static final Pattern GROUP_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private PatternCompiler() {}

    public static CompiledPattern compile(String regex) {
        return compile(regex, 0);
    }

    public static CompiledPattern compile(String regex, int flags) {
        if (regex == null || regex.isEmpty()) {
            throw new PatternSyntaxException("Empty pattern", String.valueOf(regex), 0);
        }
        Map<String, String> aliases = new LinkedHashMap<>();
        List<String> names = new ArrayList<>();
        StringBuilder out = new StringBuilder(regex.length() + 16);

        int classDepth = 0;
        int i = 0;
        while (i < regex.length()) {
            char c = regex.charAt(i);

            // ---- 이스케이프: \k<name> 만 재작성, 나머지는 두 글자 그대로 ----
            if (c == '\\') {
                if (classDepth == 0 && regex.startsWith("\\k<", i)) {
                    int end = closing(regex, i + 3, '>');
                    out.append("\\k<").append(aliasOf(aliases, regex, regex.substring(i + 3, end), i)).append('>');
                    i = end + 1;
                    continue;
                }
                out.append(c);
                if (i + 1 < regex.length()) out.append(regex.charAt(i + 1));
                i += 2;
                continue;
            }

            // ---- 문자 클래스 내부는 건드리지 않음 ----
            if (c == '[') {
                classDepth++;
            } else if (c == ']' && classDepth > 0) {
                classDepth--;
            } else if (c == '(' && classDepth == 0) {
                if (regex.startsWith("(?P<", i)) {
                    i = declare(regex, i, i + 4, aliases, names, out);
                    continue;
                }
                if (regex.startsWith("(?<", i) && i + 3 < regex.length()
                        && regex.charAt(i + 3) != '=' && regex.charAt(i + 3) != '!') {
                    i = declare(regex, i, i + 3, aliases, names, out);
                    continue;
                }
                if (regex.startsWith("(?P=", i)) {
                    int end = closing(regex, i + 4, ')');
                    out.append("\\k<").append(aliasOf(aliases, regex, regex.substring(i + 4, end), i)).append('>');
                    i = end + 1;
                    continue;
                }
            }
            out.append(c);
            i++;
        }

        Pattern p = Pattern.compile(out.toString(), flags);
        return new CompiledPattern(regex, p, names, aliases);
    }

    /** 그룹 선언을 별칭으로 치환하고 이름 다음 위치를 돌려준다. */
    private static int declare(String regex, int start, int nameStart,
                               Map<String, String> aliases, List<String> names, StringBuilder out) {
        int end = closing(regex, nameStart, '>');
        String name = regex.substring(nameStart, end);
        if (!GROUP_NAME.matcher(name).matches()) {
            throw new PatternSyntaxException("Invalid group name '" + name + "'", regex, start);
        }
        if (aliases.containsKey(name)) {
            throw new PatternSyntaxException("Duplicate group name '" + name + "'", regex, start);
        }
        String alias = "g" + (names.size() + 1);
        aliases.put(name, alias);
        names.add(name);
        out.append("(?<").append(alias).append('>');
        return end + 1;
    }

    private static String aliasOf(Map<String, String> aliases, String regex, String name, int at) {
        String alias = aliases.get(name);
        if (alias == null) {
            throw new PatternSyntaxException("Unknown group name '" + name + "'", regex, at);
        }
        return alias;
    }

    private static int closing(String regex, int from, char close) {
        int end = regex.indexOf(close, from);
        if (end < 0) {
            throw new PatternSyntaxException("Unterminated group name", regex, from);
        }
        return end;
    }
}
