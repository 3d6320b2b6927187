package com.auditsift.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** 시스템 1대에서 나온 매칭 1건 */
public final class SearchResult {
    private final String systemName;
    private final int lineNumber;                          // 라인 모드: 물리 라인, 레코드 모드: 1-based 레코드 번호
    private final String matchedText;
    private final Map<String, FieldValue> extractedFields; // field_list 가 없으면 null

    private SearchResult(Builder b) {
        this.systemName = b.systemName;
        this.lineNumber = b.lineNumber;
        this.matchedText = b.matchedText;
        this.extractedFields = (b.extractedFields == null)
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(b.extractedFields));
    }

    public String getSystemName() { return systemName; }
    public int getLineNumber() { return lineNumber; }
    public String getMatchedText() { return matchedText; }
    public Map<String, FieldValue> getExtractedFields() { return extractedFields; }

    public boolean hasExtractedFields() { return extractedFields != null; }

    /** 같은 값, 다른 텍스트/필드로 복사 (정제 단계용) */
    public Builder toBuilder() {
        return builder()
                .systemName(systemName)
                .lineNumber(lineNumber)
                .matchedText(matchedText)
                .extractedFields(extractedFields);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SearchResult r)) return false;
        return lineNumber == r.lineNumber
                && systemName.equals(r.systemName)
                && matchedText.equals(r.matchedText)
                && Objects.equals(extractedFields, r.extractedFields);
    }

    @Override
    public int hashCode() { return Objects.hash(systemName, lineNumber, matchedText, extractedFields); }

    @Override
    public String toString() {
        return systemName + ":" + lineNumber + " " + matchedText + (extractedFields == null ? "" : " " + extractedFields);
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String systemName;
        private int lineNumber;
        private String matchedText;
        private Map<String, FieldValue> extractedFields;

        public Builder systemName(String systemName) { this.systemName = systemName; return this; }
        public Builder lineNumber(int lineNumber) { this.lineNumber = lineNumber; return this; }
        public Builder matchedText(String matchedText) { this.matchedText = matchedText; return this; }
        public Builder extractedFields(Map<String, FieldValue> extractedFields) { this.extractedFields = extractedFields; return this; }

        public SearchResult build() {
            Objects.requireNonNull(systemName, "systemName");
            Objects.requireNonNull(matchedText, "matchedText");
            if (lineNumber < 1) throw new IllegalArgumentException("lineNumber must be >= 1");
            return new SearchResult(this);
        }
    }
}
