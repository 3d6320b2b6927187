package com.auditsift.core.config;

import com.auditsift.core.model.FilterAttribute;
import com.auditsift.core.model.FilterOperator;
import com.auditsift.core.model.SearchConfig;
import com.auditsift.core.model.SystemFilter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 결과 시트 이름 점검. 스프레드시트 쪽 제약(31자, 금지 문자, OS 계열 내 중복)을 미리 경고한다.
 * 경고만 돌려주고 로딩을 막지는 않는다.
 */
public final class SheetNameValidator {

    static final int MAX_SHEET_NAME = 31;
    private static final String FORBIDDEN = "/\\?*[]:";

    private SheetNameValidator() {}

    public static List<String> validate(List<SearchConfig> configs) {
        List<String> warnings = new ArrayList<>();
        Map<String, String> seen = new HashMap<>();   // scope|name(lower) → 최초 규칙명

        for (SearchConfig c : configs) {
            String sheet = c.getExcelSheetName();
            if (sheet.length() > MAX_SHEET_NAME) {
                warnings.add("Sheet name '" + sheet + "' of search '" + c.getName()
                        + "' is longer than " + MAX_SHEET_NAME + " characters");
            }
            for (char ch : FORBIDDEN.toCharArray()) {
                if (sheet.indexOf(ch) >= 0) {
                    warnings.add("Sheet name '" + sheet + "' of search '" + c.getName()
                            + "' contains forbidden character '" + ch + "'");
                    break;
                }
            }
            String scope = scopeOf(c);
            String key = scope + "|" + sheet.toLowerCase(Locale.ROOT);
            String first = seen.putIfAbsent(key, c.getName());
            if (first != null) {
                warnings.add("Sheet name '" + sheet + "' is used by both '" + first + "' and '"
                        + c.getName() + "' in scope " + scope);
            }
        }
        return warnings;
    }

    /** os_family eq 필터가 있으면 그 값, 없으면 All */
    static String scopeOf(SearchConfig c) {
        for (SystemFilter f : c.getSysFilter()) {
            if (f.attr() == FilterAttribute.OS_FAMILY && f.comp() == FilterOperator.EQ) {
                return String.valueOf(f.value());
            }
        }
        return "All";
    }
}
