package com.auditsift.core.classify;

import com.auditsift.core.model.DistroFamily;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/** /etc/os-release NAME= 줄로 리눅스 패키지 계열 판별 */
final class DistroTable {

    private static final String PREFIX = "^System_VersionInformation::/etc/os-release::NAME=\"";
    private static final Pattern NAME_LINE = Pattern.compile(PREFIX, Pattern.CASE_INSENSITIVE);

    private static final Map<DistroFamily, Pattern> TABLE = new LinkedHashMap<>();
    static {
        TABLE.put(DistroFamily.DEB, family("(Debian|Gentoo|Kali.*|Knoppix|Mint|Raspbian|PopOS|Ubuntu)"));
        TABLE.put(DistroFamily.RPM, family("(Alma|Amazon|CentOS|ClearOS|Fedora|Mandriva|Oracle|(Red Hat)|Redhat|Rocky|SUSE|openSUSE)"));
        TABLE.put(DistroFamily.APK, family("(Alpine)"));
    }

    private DistroTable() {}

    private static Pattern family(String names) {
        return Pattern.compile(PREFIX + names, Pattern.CASE_INSENSITIVE);
    }

    /** NAME= 줄이 아니면 null, 알려진 계열이 없으면 OTHER */
    static DistroFamily classify(String line) {
        if (!NAME_LINE.matcher(line).find()) return null;
        for (Map.Entry<DistroFamily, Pattern> e : TABLE.entrySet()) {
            if (e.getValue().matcher(line).find()) return e.getKey();
        }
        return DistroFamily.OTHER;
    }
}
