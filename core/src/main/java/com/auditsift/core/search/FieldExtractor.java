package com.auditsift.core.search;

import com.auditsift.core.model.FieldValue;
import com.auditsift.core.model.MergeFieldRule;
import com.auditsift.core.model.SearchConfig;
import com.auditsift.core.util.CompiledPattern;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * 매칭 → 필드 맵.
 * field_list 가 있으면 그 순서대로(없는 그룹은 NULL), 없으면 패턴의 이름 있는 그룹 전체.
 * 값은 정수 형태면 숫자로 승격하고 마지막에 merge_fields 를 적용한다.
 */
final class FieldExtractor {

    private FieldExtractor() {}

    /** @return 추출 대상 그룹이 하나도 없으면 null */
    static Map<String, FieldValue> extract(SearchConfig config, Matcher m) {
        CompiledPattern p = config.getRegex();
        List<String> names = config.hasFieldList() ? config.getFieldList() : p.groupNames();
        if (names.isEmpty()) return null;

        Map<String, FieldValue> fields = new LinkedHashMap<>();
        for (String name : names) {
            String raw = p.group(m, name);
            fields.put(name, FieldValue.ofRaw(raw == null ? null : ResultProcessor.sanitize(raw)));
        }
        return mergeFields(fields, config.getMergeFields());
    }

    /**
     * 규칙마다 source 중 첫 번째 비어있지 않은 값을 dest 로 옮기고 source 컬럼은 모두 제거한다.
     * dest 는 첫 source 컬럼 자리에 들어가며, 값이 하나도 없으면 추가하지 않는다.
     */
    static Map<String, FieldValue> mergeFields(Map<String, FieldValue> fields, List<MergeFieldRule> rules) {
        if (rules == null || rules.isEmpty()) return fields;
        Map<String, FieldValue> current = fields;
        for (MergeFieldRule rule : rules) {
            FieldValue chosen = null;
            for (String src : rule.sourceColumns()) {
                FieldValue v = current.get(src);
                if (v != null && !v.isEmpty()) {
                    chosen = v;
                    break;
                }
            }

            Map<String, FieldValue> next = new LinkedHashMap<>();
            boolean inserted = false;
            for (Map.Entry<String, FieldValue> e : current.entrySet()) {
                String key = e.getKey();
                if (rule.sourceColumns().contains(key)) {
                    if (!inserted && chosen != null) {
                        next.put(rule.destColumn(), chosen);
                        inserted = true;
                    }
                    continue;
                }
                if (chosen != null && key.equals(rule.destColumn())) continue;
                next.put(key, e.getValue());
            }
            current = next;
        }
        return current;
    }
}
