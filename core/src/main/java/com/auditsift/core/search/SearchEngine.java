package com.auditsift.core.search;

import com.auditsift.core.api.ISearchEngine;
import com.auditsift.core.filter.SystemFilterEvaluator;
import com.auditsift.core.io.AuditFiles;
import com.auditsift.core.model.AuditSystem;
import com.auditsift.core.model.SearchConfig;
import com.auditsift.core.model.SearchResult;
import com.auditsift.core.model.SearchResults;
import com.auditsift.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 덤프 파일 검색.
 * - 라인 모드: 한 줄씩 읽으며 find(), 노이즈/빈 줄 건너뜀(full_scan 이면 빈 줄도 검사)
 * - 레코드 모드(multiline): 파일 전체를 rs_delimiter 로 잘라 레코드 단위 find()
 * 결과 순서는 (시스템 순서, 줄/레코드 번호) 를 따른다.
 */
public final class SearchEngine implements ISearchEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SearchEngine.class);
    private static final StructuredLog SLOG = StructuredLog.get(SearchEngine.class);

    @Override
    public SearchResults executeSearch(SearchConfig config, List<AuditSystem> systems) {
        List<AuditSystem> targets = SystemFilterEvaluator.filterSystems(systems, config.getSysFilter());
        List<SearchResult> raw = new ArrayList<>();
        for (AuditSystem s : targets) {
            raw.addAll(searchSystem(config, s));
        }
        SearchResults out = assemble(config, raw);
        LOG.debug("Search '{}' over {} systems -> {} results", config.getName(), targets.size(), out.count());
        return out;
    }

    /** 규칙 목록 전체를 순차 수행 (설정 순서 유지) */
    public List<SearchResults> executeAll(List<SearchConfig> configs, List<AuditSystem> systems) {
        List<SearchResults> out = new ArrayList<>(configs.size());
        for (SearchConfig c : configs) {
            out.add(executeSearch(c, systems));
        }
        return out;
    }

    /** 시스템별 결과를 이어붙인 목록에 unique 적용 */
    public static SearchResults assemble(SearchConfig config, List<SearchResult> raw) {
        List<SearchResult> results = config.isUnique() ? ResultProcessor.dedupe(raw) : raw;
        return new SearchResults(config, results);
    }

    @Override
    public List<SearchResult> searchSystem(SearchConfig config, AuditSystem system) {
        try {
            return config.isMultiline() ? searchRecords(config, system) : searchLines(config, system);
        } catch (IOException | UncheckedIOException e) {
            LOG.warn("Cannot scan {} for '{}': {}", system.getFile(), config.getName(), e.toString());
            SLOG.warn("scan-io-error", "system", system.getName(), "search", config.getName(), "error", e.toString());
            return List.of();
        }
    }

    @Override
    public List<SearchConfig> filterApplicableSearches(List<SearchConfig> configs, List<AuditSystem> systems) {
        if (configs == null || configs.isEmpty() || systems == null || systems.isEmpty()) return List.of();
        List<SearchConfig> out = new ArrayList<>();
        for (SearchConfig c : configs) {
            boolean applicable = false;
            for (AuditSystem s : systems) {
                if (SystemFilterEvaluator.matches(s, c.getSysFilter())) {
                    applicable = true;
                    break;
                }
            }
            if (applicable) out.add(c);
            else LOG.debug("Search '{}' applies to no system", c.getName());
        }
        return out;
    }

    /* =========================
       라인 모드
       ========================= */

    private List<SearchResult> searchLines(SearchConfig config, AuditSystem system) throws IOException {
        List<SearchResult> out = new ArrayList<>();
        try (BufferedReader r = AuditFiles.openReader(system.getFile(), system.getEncoding())) {
            String line;
            int lineNo = 0;
            while ((line = r.readLine()) != null) {
                lineNo++;
                checkCancel(system);
                if (NoiseLineFilter.isNoise(line)) continue;
                if (!config.isFullScan() && line.isBlank()) continue;

                Matcher m = config.getRegex().matcher(line);
                if (!m.find()) continue;

                String text = config.isOnlyMatching() ? m.group() : line.strip();
                out.add(toResult(config, system, lineNo, text, m));
                if (config.isLimitReached(out.size())) break;
            }
        }
        return out;
    }

    /* =========================
       레코드 모드
       ========================= */

    private List<SearchResult> searchRecords(SearchConfig config, AuditSystem system) throws IOException {
        String content = AuditFiles.readAll(system.getFile(), system.getEncoding());
        String[] records = splitRecords(content, config.getRsDelimiter());

        List<SearchResult> out = new ArrayList<>();
        for (int i = 0; i < records.length; i++) {
            checkCancel(system);
            String record = records[i];
            if (record.isBlank()) continue;

            Matcher m = config.getRegex().matcher(record);
            if (!m.find()) continue;

            // 레코드 번호는 빈 레코드를 포함한 1-기반 위치
            out.add(toResult(config, system, i + 1, record.strip(), m));
            if (config.isLimitReached(out.size())) break;
        }
        return out;
    }

    /** 구분자는 리터럴. 없으면 파일 전체가 레코드 1개. */
    static String[] splitRecords(String content, String delimiter) {
        if (delimiter == null || delimiter.isEmpty()) return new String[]{content};
        return content.split(Pattern.quote(delimiter), -1);
    }

    private static SearchResult toResult(SearchConfig config, AuditSystem system, int number, String text, Matcher m) {
        return SearchResult.builder()
                .systemName(system.getName())
                .lineNumber(number)
                .matchedText(ResultProcessor.sanitize(text))
                .extractedFields(FieldExtractor.extract(config, m))
                .build();
    }

    private static void checkCancel(AuditSystem system) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Scan interrupted: " + system.getName());
        }
    }
}
