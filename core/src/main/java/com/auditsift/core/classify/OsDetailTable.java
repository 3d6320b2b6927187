package com.auditsift.core.classify;

import com.auditsift.core.model.AuditSystem;
import com.auditsift.core.model.ProducerType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 수집기별 OS 상세 추출 표.
 * 필수 필드가 모두 잡혔을 때만 표시 문자열을 만든다 (일부만 잡히면 null, 부분 레코드 없음).
 */
final class OsDetailTable {

    private record Field(String key, Pattern pattern, boolean required) {}

    private final List<Field> fields;
    private final Function<Map<String, String>, String> format;
    private final Map<String, String> captured = new LinkedHashMap<>();

    private OsDetailTable(List<Field> fields, Function<Map<String, String>, String> format) {
        this.fields = fields;
        this.format = format;
    }

    private static Field required(String key, String regex) {
        return new Field(key, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), true);
    }

    private static Field optional(String key, String regex) {
        return new Field(key, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), false);
    }

    static OsDetailTable forProducer(ProducerType producer) {
        return switch (producer) {
            case KPWINAUDIT -> windows();
            case KPNIXAUDIT -> linux();
            case KPMACAUDIT -> mac();
            case OTHER -> new OsDetailTable(List.of(), m -> null);
        };
    }

    static OsDetailTable windows() {
        return new OsDetailTable(List.of(
                required(AuditSystem.PRODUCT_NAME, "^System_OSInfo::ProductName\\s*:\\s*(.*)"),
                required(AuditSystem.RELEASE_ID, "^System_OSInfo::ReleaseId\\s*:\\s*(.*)"),
                required(AuditSystem.CURRENT_BUILD, "^System_OSInfo::CurrentBuild\\s*:\\s*(\\d+)"),
                required(AuditSystem.UBR, "^System_OSInfo::UBR\\s*:\\s*(\\d+)")),
                m -> m.get(AuditSystem.PRODUCT_NAME) + " (Build " + m.get(AuditSystem.CURRENT_BUILD)
                        + "." + m.get(AuditSystem.UBR) + ")");
    }

    static OsDetailTable linux() {
        return new OsDetailTable(List.of(
                required(AuditSystem.OS_PRETTY_NAME, "^System_VersionInformation::/etc/os-release::PRETTY_NAME=\"(.*)\""),
                optional(AuditSystem.OS_VERSION, "^System_VersionInformation::/etc/os-release::VERSION_ID=\"?([^\"]*)\"?")),
                m -> m.get(AuditSystem.OS_PRETTY_NAME));
    }

    static OsDetailTable mac() {
        return new OsDetailTable(List.of(
                required(AuditSystem.PRODUCT_NAME, "^System_VersionInformation::ProductName\\s*:\\s*(.*)"),
                required(AuditSystem.PRODUCT_VERSION, "ProductVersion\\s*:\\s*([\\d.]+)"),
                required(AuditSystem.BUILD_VERSION, "BuildVersion\\s*:\\s*([A-Za-z0-9]+)")),
                m -> m.get(AuditSystem.PRODUCT_NAME) + " " + m.get(AuditSystem.PRODUCT_VERSION)
                        + " (Build " + m.get(AuditSystem.BUILD_VERSION) + ")");
    }

    /** 아직 안 잡힌 필드만 검사, 먼저 잡힌 값이 유지된다. */
    void accept(String line) {
        for (Field f : fields) {
            if (captured.containsKey(f.key())) continue;
            Matcher m = f.pattern().matcher(line);
            if (m.find()) {
                captured.put(f.key(), m.group(1).trim());
                return;
            }
        }
    }

    /** 모든 필드(선택 포함)를 잡았으면 더 읽을 필요 없음 */
    boolean isComplete() {
        return captured.size() == fields.size();
    }

    boolean hasAllRequired() {
        for (Field f : fields) {
            if (f.required() && !captured.containsKey(f.key())) return false;
        }
        return !fields.isEmpty();
    }

    /** 필수 필드가 다 있을 때만 표시 문자열, 아니면 null */
    String displayName() {
        return hasAllRequired() ? format.apply(captured) : null;
    }

    /** 필수 필드가 다 있을 때만 속성, 아니면 빈 맵 */
    Map<String, String> attributes() {
        return hasAllRequired() ? Map.copyOf(captured) : Map.of();
    }
}
