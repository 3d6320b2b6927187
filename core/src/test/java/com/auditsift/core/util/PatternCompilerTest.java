package com.auditsift.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.regex.Matcher;
import java.util.regex.PatternSyntaxException;

import static org.assertj.core.api.Assertions.*;

class PatternCompilerTest {

    @Test
    @DisplayName("(?P<name>) 그룹 이름에 '_' 가 있어도 원래 이름으로 조회된다")
    void p_style_named_groups_keep_original_names() {
        CompiledPattern p = PatternCompiler.compile("KPWINVERSION: (?P<kp_win_version>\\d+\\.\\d+\\.\\d+)");

        Matcher m = p.matcher("System_PSDetails::KPWINVERSION: 0.4.7");
        assertThat(m.find()).isTrue();
        assertThat(p.groupNames()).containsExactly("kp_win_version");
        assertThat(p.hasGroup("kp_win_version")).isTrue();
        assertThat(p.group(m, "kp_win_version")).isEqualTo("0.4.7");
        assertThat(p.group(m, "nope")).isNull();
        assertThat(p.source()).contains("(?P<kp_win_version>");
    }

    @Test
    void group_order_follows_declaration_order() {
        CompiledPattern p = PatternCompiler.compile("(?P<first_name>\\w+) (?<lastName>\\w+) (?P<age_years>\\d+)");
        assertThat(p.groupNames()).containsExactly("first_name", "lastName", "age_years");

        Matcher m = p.matcher("ada lovelace 36");
        assertThat(m.find()).isTrue();
        assertThat(p.group(m, "lastName")).isEqualTo("lovelace");
        assertThat(p.group(m, "age_years")).isEqualTo("36");
    }

    @Test
    void backreferences_are_rewritten() {
        CompiledPattern py = PatternCompiler.compile("(?P<word_1>\\w+) (?P=word_1)");
        assertThat(py.matcher("hello hello").find()).isTrue();
        assertThat(py.matcher("hello world").find()).isFalse();

        CompiledPattern java = PatternCompiler.compile("(?<w>\\w+)-\\k<w>");
        assertThat(java.matcher("ab-ab").find()).isTrue();
    }

    @Test
    void lookbehind_and_character_classes_are_left_alone() {
        CompiledPattern p = PatternCompiler.compile("(?<=user=)[(?P<x>]+|(?<!no)(?P<val>\\d+)");
        assertThat(p.groupNames()).containsExactly("val");
        assertThat(p.matcher("user=(?P<x>").find()).isTrue();
    }

    @Test
    void escaped_parenthesis_is_not_a_group() {
        CompiledPattern p = PatternCompiler.compile("\\(?P<not_group>\\)");
        assertThat(p.groupNames()).isEmpty();
        assertThat(p.matcher("(P<not_group>)").find()).isTrue();
    }

    @Test
    void invalid_patterns_are_rejected() {
        assertThatThrownBy(() -> PatternCompiler.compile("(?P<dup>a)(?P<dup>b)"))
                .isInstanceOf(PatternSyntaxException.class)
                .hasMessageContaining("Duplicate group name");
        assertThatThrownBy(() -> PatternCompiler.compile("(?P=missing)"))
                .isInstanceOf(PatternSyntaxException.class)
                .hasMessageContaining("Unknown group name");
        assertThatThrownBy(() -> PatternCompiler.compile("(?P<1bad>a)"))
                .isInstanceOf(PatternSyntaxException.class);
        assertThatThrownBy(() -> PatternCompiler.compile("(unclosed"))
                .isInstanceOf(PatternSyntaxException.class);
        assertThatThrownBy(() -> PatternCompiler.compile(""))
                .isInstanceOf(PatternSyntaxException.class);
    }
}
