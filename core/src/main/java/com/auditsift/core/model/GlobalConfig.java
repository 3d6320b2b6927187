package com.auditsift.core.model;

import java.util.List;

/** 한 설정 파일의 `global:` 블록. 지정되지 않은 항목은 null. */
public final class GlobalConfig {

    public static final GlobalConfig EMPTY = new GlobalConfig();

    private List<SystemFilter> sysFilter = List.of();
    private Integer maxResults;
    private Boolean onlyMatching;
    private Boolean unique;
    private Boolean fullScan;

    public List<SystemFilter> getSysFilter() { return sysFilter; }
    public Integer getMaxResults() { return maxResults; }
    public Boolean getOnlyMatching() { return onlyMatching; }
    public Boolean getUnique() { return unique; }
    public Boolean getFullScan() { return fullScan; }

    public GlobalConfig setSysFilter(List<SystemFilter> sysFilter) {
        this.sysFilter = (sysFilter == null) ? List.of() : List.copyOf(sysFilter);
        return this;
    }
    public GlobalConfig setMaxResults(Integer maxResults) { this.maxResults = maxResults; return this; }
    public GlobalConfig setOnlyMatching(Boolean onlyMatching) { this.onlyMatching = onlyMatching; return this; }
    public GlobalConfig setUnique(Boolean unique) { this.unique = unique; return this; }
    public GlobalConfig setFullScan(Boolean fullScan) { this.fullScan = fullScan; return this; }

    public boolean isEmpty() {
        return sysFilter.isEmpty() && maxResults == null && onlyMatching == null
                && unique == null && fullScan == null;
    }

    public void validate() {
        if (maxResults != null && maxResults != SearchConfig.UNLIMITED && maxResults < 1) {
            throw new IllegalArgumentException("global max_results must be -1 or a positive integer, got " + maxResults);
        }
    }
}
