package com.auditsift.core.model;

import java.util.List;
import java.util.Objects;

/** 여러 추출 필드 중 첫 번째 비어있지 않은 값을 dest 컬럼 하나로 합친다. */
public record MergeFieldRule(List<String> sourceColumns, String destColumn) {

    public MergeFieldRule {
        Objects.requireNonNull(sourceColumns, "sourceColumns");
        if (sourceColumns.size() < 2) {
            throw new IllegalArgumentException("merge_fields requires at least 2 source_columns, got " + sourceColumns.size());
        }
        if (destColumn == null || destColumn.isBlank()) {
            throw new IllegalArgumentException("merge_fields requires a dest_column");
        }
        sourceColumns = List.copyOf(sourceColumns);
    }
}
