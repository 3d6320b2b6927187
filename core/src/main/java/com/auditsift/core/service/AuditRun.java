package com.auditsift.core.service;

import com.auditsift.core.model.AuditSystem;
import com.auditsift.core.model.OsFamily;
import com.auditsift.core.model.RunSummary;
import com.auditsift.core.model.SearchResult;
import com.auditsift.core.model.SearchResults;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** 한 번의 실행 결과: 규칙별 결과(설정 순서), 분류된 시스템, 요약 */
public final class AuditRun {
    private final List<SearchResults> results;
    private final List<AuditSystem> systems;
    private final RunSummary summary;
    private final Instant startedAt;

    public AuditRun(List<SearchResults> results, List<AuditSystem> systems, RunSummary summary, Instant startedAt) {
        this.results = List.copyOf(results);
        this.systems = List.copyOf(systems);
        this.summary = Objects.requireNonNull(summary, "summary");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
    }

    public List<SearchResults> getResults() { return results; }
    public List<AuditSystem> getSystems() { return systems; }
    public RunSummary getSummary() { return summary; }
    public Instant getStartedAt() { return startedAt; }

    /** 이름으로 규칙 결과 조회 (없으면 null). 이름이 중복되면 먼저 실행된 규칙. 전체는 {@link #getResults()}. */
    public SearchResults resultsFor(String searchName) {
        for (SearchResults r : results) {
            if (r.config().getName().equals(searchName)) return r;
        }
        return null;
    }

    /** 결과에 등장하는 OS 계열 (시스템 순서) */
    public Set<OsFamily> osFamilies() {
        Set<OsFamily> out = new LinkedHashSet<>();
        for (AuditSystem s : systems) out.add(s.getOsFamily());
        return out;
    }

    /** 해당 OS 계열 시스템의 결과만 남긴 규칙별 목록. 결과가 0건인 규칙은 빠진다. */
    public List<SearchResults> resultsFor(OsFamily family) {
        Set<String> names = new HashSet<>();
        for (AuditSystem s : systems) {
            if (s.getOsFamily() == family) names.add(s.getName());
        }
        List<SearchResults> out = new ArrayList<>();
        for (SearchResults r : results) {
            List<SearchResult> kept = new ArrayList<>();
            for (SearchResult hit : r.results()) {
                if (names.contains(hit.getSystemName())) kept.add(hit);
            }
            if (!kept.isEmpty()) out.add(new SearchResults(r.config(), kept));
        }
        return out;
    }
}
