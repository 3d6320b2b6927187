package com.auditsift.core.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 한 번의 실행 요약: 분류/실행 건수, 검색별 매칭 수, 중단 여부.
 * 검색 이름은 include 사이에서 중복될 수 있으므로 매칭 수는 실행된 규칙 순서의 목록으로 보관한다.
 */
public final class RunSummary {
    private final int systemsClassified;
    private final int filesSkipped;
    private final int searchesLoaded;
    private final int searchesExecuted;
    private final List<SearchCount> searchCounts;
    private final int interruptStage;
    private final int failedUnits;
    private final Duration elapsed;

    public RunSummary(int systemsClassified, int filesSkipped, int searchesLoaded, int searchesExecuted,
                      List<SearchCount> searchCounts, int interruptStage, int failedUnits, Duration elapsed) {
        this.systemsClassified = systemsClassified;
        this.filesSkipped = filesSkipped;
        this.searchesLoaded = searchesLoaded;
        this.searchesExecuted = searchesExecuted;
        this.searchCounts = List.copyOf(searchCounts);
        this.interruptStage = interruptStage;
        this.failedUnits = failedUnits;
        this.elapsed = elapsed;
    }

    public int getSystemsClassified() { return systemsClassified; }
    public int getFilesSkipped() { return filesSkipped; }
    public int getSearchesLoaded() { return searchesLoaded; }
    public int getSearchesExecuted() { return searchesExecuted; }
    /** 실행된 규칙별 매칭 수 (규칙 순서, 이름 중복 가능) */
    public List<SearchCount> getSearchCounts() { return searchCounts; }

    /** 이름별 매칭 수. 같은 이름의 규칙이 여럿이면 합산한다. */
    public Map<String, Integer> getMatchCounts() {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (SearchCount c : searchCounts) out.merge(c.name(), c.count(), Integer::sum);
        return Collections.unmodifiableMap(out);
    }
    public int getInterruptStage() { return interruptStage; }
    public int getFailedUnits() { return failedUnits; }
    public Duration getElapsed() { return elapsed; }

    /** 인터럽트로 일부만 수행된 실행 */
    public boolean isPartial() { return interruptStage > 0; }

    public int getTotalMatches() {
        int sum = 0;
        for (SearchCount c : searchCounts) sum += c.count();
        return sum;
    }

    @Override
    public String toString() {
        return (isPartial() ? "PARTIAL " : "") + "RunSummary{systems=" + systemsClassified
                + ", skipped=" + filesSkipped
                + ", searches=" + searchesExecuted + "/" + searchesLoaded
                + ", matches=" + getTotalMatches()
                + ", failedUnits=" + failedUnits
                + ", elapsedMs=" + (elapsed == null ? 0 : elapsed.toMillis()) + "}";
    }

    /** 규칙 1개의 매칭 수 */
    public record SearchCount(String name, int count) {
        public SearchCount {
            Objects.requireNonNull(name, "name");
        }
    }
}
