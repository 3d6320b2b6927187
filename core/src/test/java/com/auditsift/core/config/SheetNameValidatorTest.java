package com.auditsift.core.config;

import com.auditsift.core.model.FilterAttribute;
import com.auditsift.core.model.FilterOperator;
import com.auditsift.core.model.SearchConfig;
import com.auditsift.core.model.SystemFilter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SheetNameValidatorTest {

    private static SearchConfig search(String name, String sheet, String osFamily) {
        SearchConfig.Builder b = SearchConfig.builder(name).regex("x").excelSheetName(sheet);
        if (osFamily != null) {
            b.sysFilter(List.of(SystemFilter.of(FilterAttribute.OS_FAMILY, FilterOperator.EQ, osFamily)));
        }
        return b.build();
    }

    @Test
    void clean_names_produce_no_warnings() {
        assertThat(SheetNameValidator.validate(List.of(
                search("a", "Users", null),
                search("b", "Shells", null)))).isEmpty();
    }

    @Test
    void long_and_forbidden_names_are_reported() {
        List<String> w = SheetNameValidator.validate(List.of(
                search("long", "x".repeat(32), null),
                search("slash", "a/b", null)));

        assertThat(w).hasSize(2);
        assertThat(w.get(0)).contains("longer than 31");
        assertThat(w.get(1)).contains("forbidden character '/'");
    }

    @Test
    void duplicates_are_checked_per_os_family() {
        List<String> w = SheetNameValidator.validate(List.of(
                search("w1", "Users", "Windows"),
                search("l1", "Users", "Linux"),
                search("w2", "users", "Windows")));

        assertThat(w).hasSize(1);
        assertThat(w.get(0)).contains("'w1'").contains("'w2'").contains("Windows");
    }
}
