package com.auditsift.core.search;

import com.auditsift.core.model.AuditSystem;
import com.auditsift.core.model.FieldValue;
import com.auditsift.core.model.FilterAttribute;
import com.auditsift.core.model.FilterOperator;
import com.auditsift.core.model.MergeFieldRule;
import com.auditsift.core.model.OsFamily;
import com.auditsift.core.model.ProducerType;
import com.auditsift.core.model.SearchConfig;
import com.auditsift.core.model.SearchResult;
import com.auditsift.core.model.SearchResults;
import com.auditsift.core.model.SystemFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SearchEngineTest {

    @TempDir
    Path tmp;

    private final SearchEngine engine = new SearchEngine();

    private AuditSystem system(String name, OsFamily family, String content) throws IOException {
        Path f = tmp.resolve(name + ".txt");
        Files.writeString(f, content, StandardCharsets.UTF_8);
        return AuditSystem.builder()
                .name(name)
                .file(f)
                .encoding(StandardCharsets.UTF_8)
                .osFamily(family)
                .producer(family == OsFamily.WINDOWS ? ProducerType.KPWINAUDIT : ProducerType.KPNIXAUDIT)
                .build();
    }

    private static Map<String, FieldValue> fields(Object... kv) {
        Map<String, FieldValue> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            Object v = kv[i + 1];
            m.put((String) kv[i], v == null ? FieldValue.nullValue()
                    : v instanceof Long l ? FieldValue.number(l) : FieldValue.text((String) v));
        }
        return m;
    }

    @Nested
    class LineMode {

        @Test
        @DisplayName("User: (?P<user>\\w+) 예시: 줄마다 결과 1개, 필드는 user")
        void named_group_example() throws Exception {
            AuditSystem s = system("host1", OsFamily.LINUX, "User: alice\nUser: bob\n");
            SearchConfig c = SearchConfig.builder("users")
                    .regex("User: (?P<user>\\w+)")
                    .fieldList(List.of("user"))
                    .build();

            List<SearchResult> r = engine.searchSystem(c, s);

            assertThat(r).hasSize(2);
            assertThat(r.get(0).getExtractedFields()).isEqualTo(fields("user", "alice"));
            assertThat(r.get(1).getExtractedFields()).isEqualTo(fields("user", "bob"));
            assertThat(r.get(0).getLineNumber()).isEqualTo(1);
            assertThat(r.get(1).getLineNumber()).isEqualTo(2);
            assertThat(r.get(0).getMatchedText()).isEqualTo("User: alice");
            assertThat(r.get(0).getSystemName()).isEqualTo("host1");
        }

        @Test
        void matched_text_is_whole_trimmed_line_unless_only_matching() throws Exception {
            AuditSystem s = system("h", OsFamily.LINUX, "   prefix PermitRootLogin yes   \n");

            SearchConfig line = SearchConfig.builder("l").regex("PermitRootLogin \\w+").build();
            SearchConfig only = SearchConfig.builder("o").regex("PermitRootLogin \\w+").onlyMatching(true).build();

            assertThat(engine.searchSystem(line, s).get(0).getMatchedText()).isEqualTo("prefix PermitRootLogin yes");
            assertThat(engine.searchSystem(only, s).get(0).getMatchedText()).isEqualTo("PermitRootLogin yes");
            assertThat(engine.searchSystem(line, s).get(0).hasExtractedFields()).isFalse();
        }

        @Test
        void numbers_are_coerced_and_missing_groups_are_null() throws Exception {
            AuditSystem s = system("h", OsFamily.WINDOWS, "MinimumPasswordLength = 8\n");
            SearchConfig c = SearchConfig.builder("len")
                    .regex("MinimumPasswordLength = (?P<min_length>\\d+)(?P<unit> chars)?")
                    .fieldList(List.of("min_length", "unit", "not_a_group"))
                    .build();

            Map<String, FieldValue> f = engine.searchSystem(c, s).get(0).getExtractedFields();

            assertThat(f.keySet()).containsExactly("min_length", "unit", "not_a_group");
            assertThat(f.get("min_length")).isEqualTo(FieldValue.number(8));
            assertThat(f.get("unit").isNull()).isTrue();
            assertThat(f.get("not_a_group").isNull()).isTrue();
        }

        @Test
        void without_field_list_all_named_groups_are_extracted() throws Exception {
            AuditSystem s = system("h", OsFamily.LINUX, "root:x:0:0\n");
            SearchConfig c = SearchConfig.builder("pw").regex("(?P<account>\\w+):x:(?P<uid>\\d+)").build();

            SearchResult r = engine.searchSystem(c, s).get(0);

            assertThat(r.getExtractedFields()).isEqualTo(fields("account", "root", "uid", 0L));
            assertThat(r.getMatchedText()).isEqualTo("root:x:0:0");
        }

        @Test
        @DisplayName("### 표시 줄은 노이즈로 건너뛴다")
        void noise_lines_are_skipped() throws Exception {
            AuditSystem s = system("h", OsFamily.LINUX, """
                    ###[BEGIN]
                    ###Processing Command: id root
                    ###Running: cat /etc/passwd
                    User: real
                    #### User: fake
                    ###[END]
                    """);
            SearchConfig c = SearchConfig.builder("u").regex("User: \\w+").build();

            List<SearchResult> r = engine.searchSystem(c, s);

            assertThat(r).extracting(SearchResult::getMatchedText).containsExactly("User: real");
            assertThat(r.get(0).getLineNumber()).isEqualTo(4);
        }

        @Test
        void blank_lines_are_only_checked_with_full_scan() throws Exception {
            AuditSystem s = system("h", OsFamily.LINUX, "a\n\n   \nb\n");
            SearchConfig normal = SearchConfig.builder("n").regex("^\\s*$").build();
            SearchConfig full = SearchConfig.builder("f").regex("^\\s*$").fullScan(true).build();

            assertThat(engine.searchSystem(normal, s)).isEmpty();
            assertThat(engine.searchSystem(full, s)).extracting(SearchResult::getLineNumber).containsExactly(2, 3);
        }

        @Test
        void max_results_stops_per_system() throws Exception {
            AuditSystem s = system("h", OsFamily.LINUX, "x1\nx2\nx3\n");
            SearchConfig c = SearchConfig.builder("x").regex("x\\d").maxResults(2).build();

            assertThat(engine.searchSystem(c, s)).extracting(SearchResult::getMatchedText).containsExactly("x1", "x2");
        }

        @Test
        void control_characters_are_stripped() throws Exception {
            AuditSystem s = system("h", OsFamily.LINUX, "Banner:\u0007 hello\u0001 world\tok\n");
            SearchConfig c = SearchConfig.builder("b").regex("Banner:(?P<text>.*)").fieldList(List.of("text")).build();

            SearchResult r = engine.searchSystem(c, s).get(0);

            assertThat(r.getMatchedText()).isEqualTo("Banner: hello world\tok");
            assertThat(r.getExtractedFields().get("text").asText()).isEqualTo(" hello world\tok");
        }

        @Test
        void unreadable_file_yields_empty_list() throws Exception {
            AuditSystem s = system("h", OsFamily.LINUX, "x\n");
            Files.delete(s.getFile());

            assertThat(engine.searchSystem(SearchConfig.builder("x").regex("x").build(), s)).isEmpty();
        }
    }

    @Nested
    class MergeFields {

        @Test
        @DisplayName("a/b 중 첫 번째 비어있지 않은 값이 c 로, a/b 는 제거")
        void first_non_empty_source_wins() {
            Map<String, FieldValue> in = fields("a", "", "b", "v", "d", "w");
            MergeFieldRule rule = new MergeFieldRule(List.of("a", "b"), "c");

            Map<String, FieldValue> out = FieldExtractor.mergeFields(in, List.of(rule));

            assertThat(out).isEqualTo(fields("c", "v", "d", "w"));
            assertThat(out.keySet()).containsExactly("c", "d");
        }

        @Test
        void all_empty_sources_drop_dest() {
            Map<String, FieldValue> in = fields("a", null, "b", " ", "d", "w");
            Map<String, FieldValue> out = FieldExtractor.mergeFields(in,
                    List.of(new MergeFieldRule(List.of("a", "b"), "c")));

            assertThat(out).isEqualTo(fields("d", "w"));
        }

        @Test
        void merge_through_search() throws Exception {
            AuditSystem s = system("h", OsFamily.WINDOWS, "Owner: (none) Group: admins\nOwner: bob Group: -\n");
            SearchConfig c = SearchConfig.builder("m")
                    .regex("Owner: (?:\\(none\\)|(?P<owner>\\w+)) Group: (?:-|(?P<grp>\\w+))")
                    .fieldList(List.of("owner", "grp"))
                    .mergeFields(List.of(new MergeFieldRule(List.of("owner", "grp"), "principal")))
                    .build();

            List<SearchResult> r = engine.searchSystem(c, s);

            assertThat(r.get(0).getExtractedFields()).isEqualTo(fields("principal", "admins"));
            assertThat(r.get(1).getExtractedFields()).isEqualTo(fields("principal", "bob"));
        }
    }

    @Nested
    class RecordMode {

        @Test
        @DisplayName("구분자가 없으면 파일 전체가 레코드 1개")
        void whole_file_is_one_record() throws Exception {
            AuditSystem s = system("h", OsFamily.LINUX, "Name: svc\nState: running\n");
            SearchConfig c = SearchConfig.builder("r")
                    .regex("Name: (?P<name>\\w+)\\nState: (?P<state>\\w+)")
                    .fieldList(List.of("name", "state"))
                    .multiline(true)
                    .build();

            List<SearchResult> r = engine.searchSystem(c, s);

            assertThat(r).hasSize(1);
            assertThat(r.get(0).getLineNumber()).isEqualTo(1);
            assertThat(r.get(0).getExtractedFields()).isEqualTo(fields("name", "svc", "state", "running"));
        }

        @Test
        void records_are_split_on_literal_delimiter() throws Exception {
            AuditSystem s = system("h", OsFamily.LINUX, """
                    Name: a
                    State: running
                    .*.
                    .*.
                    Name: b
                    State: stopped
                    .*.
                    Name: c
                    State: running
                    """);
            SearchConfig c = SearchConfig.builder("r")
                    .regex("Name: (?P<name>\\w+)\\s+State: running")
                    .fieldList(List.of("name"))
                    .multiline(true)
                    .rsDelimiter(".*.")
                    .build();

            List<SearchResult> r = engine.searchSystem(c, s);

            // 레코드 번호는 빈 레코드 포함 위치
            assertThat(r).extracting(SearchResult::getLineNumber).containsExactly(1, 4);
            assertThat(r).extracting(x -> x.getExtractedFields().get("name").asText()).containsExactly("a", "c");
            assertThat(r.get(0).getMatchedText()).isEqualTo("Name: a\nState: running");
        }

        @Test
        void split_keeps_trailing_empty_records() {
            assertThat(SearchEngine.splitRecords("a|b|", "|")).containsExactly("a", "b", "");
            assertThat(SearchEngine.splitRecords("abc", null)).containsExactly("abc");
        }
    }

    @Nested
    class Execute {

        @Test
        void sys_filter_limits_systems_and_order_follows_system_list() throws Exception {
            AuditSystem win = system("win", OsFamily.WINDOWS, "User: w\n");
            AuditSystem lin = system("lin", OsFamily.LINUX, "User: l\n");
            AuditSystem lin2 = system("lin2", OsFamily.LINUX, "User: l2\n");
            SearchConfig linuxOnly = SearchConfig.builder("u").regex("User: \\w+")
                    .sysFilter(List.of(SystemFilter.of(FilterAttribute.OS_FAMILY, FilterOperator.EQ, "Linux")))
                    .build();

            SearchResults r = engine.executeSearch(linuxOnly, List.of(lin2, win, lin));

            assertThat(r.config()).isSameAs(linuxOnly);
            assertThat(r.results()).extracting(SearchResult::getSystemName).containsExactly("lin2", "lin");
        }

        @Test
        void unique_keeps_first_per_system_and_trimmed_text() throws Exception {
            AuditSystem a = system("a", OsFamily.LINUX, "dup\n  dup  \nother\n");
            AuditSystem b = system("b", OsFamily.LINUX, "dup\n");
            SearchConfig c = SearchConfig.builder("d").regex("dup|other").unique(true).build();

            SearchResults r = engine.executeSearch(c, List.of(a, b));

            assertThat(r.results()).extracting(x -> x.getSystemName() + ":" + x.getLineNumber())
                    .containsExactly("a:1", "a:3", "b:1");
        }

        @Test
        void applicable_searches_need_at_least_one_system() throws Exception {
            AuditSystem lin = system("lin", OsFamily.LINUX, "x\n");
            SearchConfig any = SearchConfig.builder("any").regex("x").build();
            SearchConfig winOnly = SearchConfig.builder("win").regex("x")
                    .sysFilter(List.of(SystemFilter.of(FilterAttribute.OS_FAMILY, FilterOperator.EQ, "Windows")))
                    .build();

            assertThat(engine.filterApplicableSearches(List.of(winOnly, any), List.of(lin))).containsExactly(any);
            assertThat(engine.filterApplicableSearches(List.of(any), List.of())).isEmpty();
            assertThat(engine.filterApplicableSearches(List.of(), List.of(lin))).isEmpty();
        }

        @Test
        void execute_all_preserves_config_order() throws Exception {
            AuditSystem lin = system("lin", OsFamily.LINUX, "x\ny\n");
            SearchConfig y = SearchConfig.builder("y").regex("y").build();
            SearchConfig x = SearchConfig.builder("x").regex("x").build();

            List<SearchResults> all = engine.executeAll(List.of(y, x), List.of(lin));

            assertThat(all).extracting(sr -> sr.config().getName()).containsExactly("y", "x");
            assertThat(all).allMatch(sr -> sr.count() == 1);
        }
    }
}
