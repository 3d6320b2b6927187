package com.auditsift.core.api;

import com.auditsift.core.model.AuditSystem;
import com.auditsift.core.model.SearchConfig;
import com.auditsift.core.model.SearchResult;
import com.auditsift.core.model.SearchResults;

import java.util.List;

/** 검색 엔진 계약: 규칙 × 시스템 목록 → 순서가 보장된 결과. */
public interface ISearchEngine {

    /** 규칙 1개를 적용 대상 시스템 전체에 수행 (unique/정제 포함) */
    SearchResults executeSearch(SearchConfig config, List<AuditSystem> systems);

    /** 작업 단위 1개: 규칙 1개 × 시스템 1대. I/O 오류는 빈 목록. */
    List<SearchResult> searchSystem(SearchConfig config, AuditSystem system);

    /** 적어도 한 시스템에 적용되는 규칙만 남긴다 (스캔 없음) */
    List<SearchConfig> filterApplicableSearches(List<SearchConfig> configs, List<AuditSystem> systems);
}
