package com.auditsift.core.config;

import com.auditsift.core.model.FilterAttribute;
import com.auditsift.core.model.FilterOperator;
import com.auditsift.core.model.SearchConfig;
import com.auditsift.core.model.SystemFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SearchConfigLoaderTest {

    @TempDir
    Path tmp;

    private Path write(String name, String yaml) throws IOException {
        Path p = tmp.resolve(name);
        Files.createDirectories(p.getParent());
        Files.writeString(p, yaml, StandardCharsets.UTF_8);
        return p;
    }

    private static List<String> names(List<SearchConfig> configs) {
        return configs.stream().map(SearchConfig::getName).toList();
    }

    @Test
    @DisplayName("단일 파일: 키 순서대로 규칙이 나온다")
    void loads_searches_in_document_order() throws Exception {
        Path f = write("a.yaml", """
                02_second:
                  regex: 'b'
                01_first:
                  regex: 'User: (?P<user>\\w+)'
                  field_list: [user]
                  comment: "local users"
                  excel_sheet_name: "Users"
                  max_results: 3
                  unique: true
                """);

        List<SearchConfig> configs = SearchConfigLoader.load(f);

        assertThat(names(configs)).containsExactly("02_second", "01_first");
        SearchConfig first = configs.get(1);
        assertThat(first.getFieldList()).containsExactly("user");
        assertThat(first.isOnlyMatching()).isTrue();
        assertThat(first.getComment()).isEqualTo("local users");
        assertThat(first.getExcelSheetName()).isEqualTo("Users");
        assertThat(first.getMaxResults()).isEqualTo(3);
        assertThat(first.isUnique()).isTrue();
    }

    @Test
    void empty_file_yields_no_searches() throws Exception {
        Path f = write("empty.yaml", "");
        assertThat(SearchConfigLoader.load(f)).isEmpty();
    }

    @Test
    void global_block_is_merged_but_not_overriding() throws Exception {
        Path f = write("g.yaml", """
                global:
                  max_results: 10
                  unique: true
                  sys_filter:
                    - attr: os_family
                      comp: eq
                      value: Windows
                keep_local:
                  regex: 'a'
                  max_results: 2
                  sys_filter:
                    - attr: current_build
                      comp: ge
                      value: 17763
                take_global:
                  regex: 'b'
                """);

        List<SearchConfig> configs = SearchConfigLoader.load(f);

        SearchConfig local = configs.get(0);
        assertThat(local.getMaxResults()).isEqualTo(2);
        assertThat(local.isUnique()).isTrue();
        assertThat(local.getSysFilter()).extracting(SystemFilter::attr)
                .containsExactly(FilterAttribute.OS_FAMILY, FilterAttribute.CURRENT_BUILD);

        SearchConfig global = configs.get(1);
        assertThat(global.getMaxResults()).isEqualTo(10);
        assertThat(global.getSysFilter()).containsExactly(
                SystemFilter.of(FilterAttribute.OS_FAMILY, FilterOperator.EQ, "Windows"));
    }

    @Test
    void in_filter_and_merge_fields_are_parsed() throws Exception {
        Path f = write("m.yaml", """
                merged:
                  regex: '(?P<a>x)?(?P<b>y)?'
                  field_list: [a, b]
                  merge_fields:
                    - source_columns: [a, b]
                      dest_column: c
                  sys_filter:
                    - attr: distro_family
                      comp: in
                      value: [deb, rpm]
                """);

        SearchConfig c = SearchConfigLoader.load(f).get(0);

        assertThat(c.getMergeFields()).hasSize(1);
        assertThat(c.getMergeFields().get(0).sourceColumns()).containsExactly("a", "b");
        assertThat(c.getMergeFields().get(0).destColumn()).isEqualTo("c");
        assertThat(c.getSysFilter().get(0).comp()).isEqualTo(FilterOperator.IN);
        assertThat(c.getSysFilter().get(0).values()).containsExactly("deb", "rpm");
    }

    @Test
    void in_filter_keeps_null_member() throws Exception {
        Path f = write("n.yaml", """
                with_null:
                  regex: 'x'
                  sys_filter:
                    - attr: os_family
                      comp: in
                      value: [Linux, ~]
                """);

        SearchConfig c = SearchConfigLoader.load(f).get(0);

        assertThat(c.getSysFilter().get(0).values()).containsExactly("Linux", null);
    }

    @Test
    void scalar_value_with_in_operator_names_the_search() throws Exception {
        Path f = write("s.yaml", """
                not_a_list:
                  regex: 'x'
                  sys_filter:
                    - attr: os_family
                      comp: in
                      value: Linux
                """);

        assertThatThrownBy(() -> SearchConfigLoader.load(f))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("not_a_list");
    }

    @Nested
    class Includes {

        @Test
        @DisplayName("include 는 포함하는 파일 기준 상대경로, 결과는 로컬 규칙 뒤에 붙는다")
        void include_is_relative_to_including_file() throws Exception {
            write("sub/child.yaml", """
                    child_search:
                      regex: 'c'
                    """);
            Path root = write("root.yaml", """
                    include_children:
                      files:
                        - "sub/child.yaml"
                    root_search:
                      regex: 'r'
                    """);

            assertThat(names(SearchConfigLoader.load(root))).containsExactly("root_search", "child_search");
        }

        @Test
        void global_does_not_leak_into_included_file() throws Exception {
            write("child.yaml", """
                    child_search:
                      regex: 'c'
                    """);
            Path root = write("root.yaml", """
                    global:
                      unique: true
                    include_x:
                      files: [child.yaml]
                    root_search:
                      regex: 'r'
                    """);

            List<SearchConfig> configs = SearchConfigLoader.load(root);
            assertThat(configs.get(0).isUnique()).isTrue();
            assertThat(configs.get(1).isUnique()).isFalse();
        }

        @Test
        void missing_include_is_skipped() throws Exception {
            Path root = write("root.yaml", """
                    include_gone:
                      files: [nowhere.yaml]
                    only:
                      regex: 'x'
                    """);

            assertThat(names(SearchConfigLoader.load(root))).containsExactly("only");
        }

        @Test
        void malformed_include_is_skipped() throws Exception {
            write("broken.yaml", "key: [unclosed\n");
            Path root = write("root.yaml", """
                    include_broken:
                      files: [broken.yaml]
                    only:
                      regex: 'x'
                    """);

            assertThat(names(SearchConfigLoader.load(root))).containsExactly("only");
        }

        @Test
        @DisplayName("자기 자신/상호 include 는 순환으로 감지하고 건너뛴다")
        void include_cycles_terminate() throws Exception {
            write("a.yaml", """
                    include_b:
                      files: [b.yaml]
                    search_a:
                      regex: 'a'
                    """);
            write("b.yaml", """
                    include_a:
                      files: [a.yaml]
                    include_self:
                      files: [b.yaml]
                    search_b:
                      regex: 'b'
                    """);

            assertThat(names(SearchConfigLoader.load(tmp.resolve("a.yaml")))).containsExactly("search_a", "search_b");
        }

        @Test
        @DisplayName("include 안의 잘못된 규칙은 그 파일만 건너뛰고 나머지는 유지")
        void invalid_search_inside_include_is_skipped() throws Exception {
            write("bad.yaml", """
                    broken:
                      regex: '(unclosed'
                    """);
            write("ok.yaml", """
                    from_ok:
                      regex: 'ok'
                    """);
            Path root = write("root.yaml", """
                    good:
                      regex: 'good'
                    include_bad:
                      files: [bad.yaml, ok.yaml]
                    """);

            assertThat(names(SearchConfigLoader.load(root))).containsExactly("good", "from_ok");
        }

        @Test
        void invalid_search_in_root_file_is_fatal() throws Exception {
            Path root = write("root.yaml", """
                    broken:
                      regex: '(unclosed'
                    """);

            assertThatThrownBy(() -> SearchConfigLoader.load(root))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("broken");
        }

        @Test
        void duplicate_names_across_files_are_kept() throws Exception {
            write("other.yaml", """
                    dup:
                      regex: 'two'
                    """);
            Path root = write("root.yaml", """
                    dup:
                      regex: 'one'
                    include_other:
                      files: [other.yaml]
                    """);

            assertThat(names(SearchConfigLoader.load(root))).containsExactly("dup", "dup");
        }

        @Test
        void fixture_tree_loads_in_order() throws Exception {
            Path root = Path.of(SearchConfigLoaderTest.class.getResource("/fixtures/conf/audit-all.yaml").toURI());

            assertThat(names(SearchConfigLoader.load(root))).containsExactly(
                    "00_local_users",
                    "01_win_password_length", "02_win_build",
                    "10_linux_login_shells", "11_linux_deb_only");
        }
    }

    @Nested
    class Errors {

        @Test
        void missing_root_file_is_an_error() {
            assertThatThrownBy(() -> SearchConfigLoader.load(tmp.resolve("nope.yaml")))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("not found");
        }

        @Test
        void invalid_regex_names_the_search() throws Exception {
            Path f = write("bad.yaml", """
                    bad_regex:
                      regex: '(?P<x>a'
                    """);

            assertThatThrownBy(() -> SearchConfigLoader.load(f))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("Invalid search 'bad_regex'")
                    .hasMessageContaining("Invalid regex pattern");
        }

        @Test
        void multiline_without_field_list_is_rejected() throws Exception {
            Path f = write("ml.yaml", """
                    ml:
                      regex: 'a'
                      multiline: true
                    """);

            assertThatThrownBy(() -> SearchConfigLoader.load(f))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("multiline requires field_list");
        }

        @Test
        void unknown_filter_attribute_is_rejected() throws Exception {
            Path f = write("flt.yaml", """
                    s:
                      regex: 'a'
                      sys_filter:
                        - attr: kernel
                          comp: eq
                          value: x
                    """);

            assertThatThrownBy(() -> SearchConfigLoader.load(f))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("Unknown filter attribute");
        }

        @Test
        void duplicate_keys_are_rejected() throws Exception {
            Path f = write("dup.yaml", """
                    same:
                      regex: 'a'
                    same:
                      regex: 'b'
                    """);

            assertThatThrownBy(() -> SearchConfigLoader.load(f)).isInstanceOf(ConfigException.class);
        }

        @Test
        void non_mapping_root_is_rejected() throws Exception {
            Path f = write("list.yaml", "- a\n- b\n");
            assertThatThrownBy(() -> SearchConfigLoader.load(f))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("mapping");
        }
    }
}
