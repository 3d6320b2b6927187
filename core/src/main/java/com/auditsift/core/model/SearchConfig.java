package com.auditsift.core.model;

import com.auditsift.core.util.CompiledPattern;
import com.auditsift.core.util.PatternCompiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.PatternSyntaxException;

/**
 * YAML 로 선언된 검색 규칙 1개. build() 시점에 정규식 컴파일과 불변조건 검사를 끝낸다.
 *
 * <ul>
 *   <li>field_list 가 있으면 only_matching 은 항상 true</li>
 *   <li>multiline 은 field_list 필요</li>
 *   <li>rs_delimiter 는 multiline + field_list 필요</li>
 *   <li>max_results 는 -1(무제한) 또는 양수</li>
 * </ul>
 */
public final class SearchConfig {

    public static final int UNLIMITED = -1;

    private final String name;
    private final CompiledPattern regex;
    private final String comment;
    private final String excelSheetName;
    private final int maxResults;
    private final List<String> fieldList;       // 비어있으면 "전체 그룹"
    private final boolean onlyMatching;
    private final boolean unique;
    private final boolean fullScan;
    private final boolean multiline;
    private final String rsDelimiter;           // nullable
    private final List<MergeFieldRule> mergeFields;
    private final List<SystemFilter> sysFilter;

    private SearchConfig(Builder b, CompiledPattern compiled) {
        this.name = b.name;
        this.regex = compiled;
        this.comment = b.comment;
        this.excelSheetName = (b.excelSheetName == null || b.excelSheetName.isBlank()) ? b.name : b.excelSheetName;
        this.maxResults = b.maxResults;
        this.fieldList = List.copyOf(b.fieldList);
        this.onlyMatching = b.onlyMatching || !fieldList.isEmpty();
        this.unique = b.unique;
        this.fullScan = b.fullScan;
        this.multiline = b.multiline;
        this.rsDelimiter = b.rsDelimiter;
        this.mergeFields = List.copyOf(b.mergeFields);
        this.sysFilter = List.copyOf(b.sysFilter);
    }

    public String getName() { return name; }
    public CompiledPattern getRegex() { return regex; }
    public String getComment() { return comment; }
    public String getExcelSheetName() { return excelSheetName; }
    public int getMaxResults() { return maxResults; }
    public List<String> getFieldList() { return fieldList; }
    public boolean hasFieldList() { return !fieldList.isEmpty(); }
    public boolean isOnlyMatching() { return onlyMatching; }
    public boolean isUnique() { return unique; }
    public boolean isFullScan() { return fullScan; }
    public boolean isMultiline() { return multiline; }
    public String getRsDelimiter() { return rsDelimiter; }
    public List<MergeFieldRule> getMergeFields() { return mergeFields; }
    public List<SystemFilter> getSysFilter() { return sysFilter; }

    /** max_results 에 도달했는지 (무제한이면 항상 false) */
    public boolean isLimitReached(int count) {
        return maxResults > 0 && count >= maxResults;
    }

    /**
     * global 기본값 병합. 로컬 값이 타입 기본값일 때만 global 값을 쓰고,
     * sys_filter 는 global 이 앞에 오도록 이어붙인다.
     */
    public SearchConfig withGlobal(GlobalConfig global) {
        if (global == null || global.isEmpty()) return this;
        Builder b = toBuilder();
        if (maxResults == UNLIMITED && global.getMaxResults() != null) b.maxResults(global.getMaxResults());
        if (!onlyMatching && Boolean.TRUE.equals(global.getOnlyMatching())) b.onlyMatching(true);
        if (!unique && Boolean.TRUE.equals(global.getUnique())) b.unique(true);
        if (!fullScan && Boolean.TRUE.equals(global.getFullScan())) b.fullScan(true);
        if (!global.getSysFilter().isEmpty()) {
            List<SystemFilter> merged = new ArrayList<>(global.getSysFilter());
            merged.addAll(sysFilter);
            b.sysFilter(merged);
        }
        return b.build();
    }

    public Builder toBuilder() {
        return builder(name)
                .regex(regex.source())
                .comment(comment)
                .excelSheetName(excelSheetName)
                .maxResults(maxResults)
                .fieldList(fieldList)
                .onlyMatching(onlyMatching)
                .unique(unique)
                .fullScan(fullScan)
                .multiline(multiline)
                .rsDelimiter(rsDelimiter)
                .mergeFields(mergeFields)
                .sysFilter(sysFilter);
    }

    @Override
    public String toString() {
        return "SearchConfig{" + name + ", regex=" + regex.source() + "}";
    }

    public static Builder builder(String name) { return new Builder().name(name); }

    public static final class Builder {
        private String name;
        private String regex;
        private String comment;
        private String excelSheetName;
        private int maxResults = UNLIMITED;
        private List<String> fieldList = List.of();
        private boolean onlyMatching;
        private boolean unique;
        private boolean fullScan;
        private boolean multiline;
        private String rsDelimiter;
        private List<MergeFieldRule> mergeFields = List.of();
        private List<SystemFilter> sysFilter = List.of();

        public Builder name(String name) { this.name = name; return this; }
        public Builder regex(String regex) { this.regex = regex; return this; }
        public Builder comment(String comment) { this.comment = comment; return this; }
        public Builder excelSheetName(String excelSheetName) { this.excelSheetName = excelSheetName; return this; }
        public Builder maxResults(int maxResults) { this.maxResults = maxResults; return this; }
        public Builder onlyMatching(boolean onlyMatching) { this.onlyMatching = onlyMatching; return this; }
        public Builder unique(boolean unique) { this.unique = unique; return this; }
        public Builder fullScan(boolean fullScan) { this.fullScan = fullScan; return this; }
        public Builder multiline(boolean multiline) { this.multiline = multiline; return this; }

        public Builder rsDelimiter(String rsDelimiter) {
            this.rsDelimiter = (rsDelimiter == null || rsDelimiter.isEmpty()) ? null : rsDelimiter;
            return this;
        }

        public Builder fieldList(List<String> fieldList) {
            this.fieldList = (fieldList == null) ? List.of() : fieldList;
            return this;
        }

        public Builder mergeFields(List<MergeFieldRule> mergeFields) {
            this.mergeFields = (mergeFields == null) ? List.of() : mergeFields;
            return this;
        }

        public Builder sysFilter(List<SystemFilter> sysFilter) {
            this.sysFilter = (sysFilter == null) ? List.of() : sysFilter;
            return this;
        }

        public SearchConfig build() {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
            if (regex == null || regex.isEmpty()) throw new IllegalArgumentException("regex is required");
            if (maxResults != UNLIMITED && maxResults < 1) {
                throw new IllegalArgumentException("max_results must be -1 or a positive integer, got " + maxResults);
            }
            if (multiline && fieldList.isEmpty()) {
                throw new IllegalArgumentException("multiline requires field_list");
            }
            if (rsDelimiter != null && (!multiline || fieldList.isEmpty())) {
                throw new IllegalArgumentException("rs_delimiter requires multiline and field_list");
            }
            for (String f : fieldList) Objects.requireNonNull(f, "field_list entry");

            CompiledPattern compiled;
            try {
                compiled = PatternCompiler.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid regex pattern: " + e.getDescription(), e);
            }
            return new SearchConfig(this, compiled);
        }
    }
}
