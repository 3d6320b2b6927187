package com.auditsift.core.service;

import com.auditsift.core.api.IFileDiscovery;
import com.auditsift.core.api.ISearchEngine;
import com.auditsift.core.classify.SystemClassifier;
import com.auditsift.core.config.AuditSettings;
import com.auditsift.core.config.ConfigException;
import com.auditsift.core.config.SearchConfigLoader;
import com.auditsift.core.filter.SystemFilterEvaluator;
import com.auditsift.core.io.GlobFileDiscovery;
import com.auditsift.core.model.AuditSystem;
import com.auditsift.core.model.RunSummary;
import com.auditsift.core.model.SearchConfig;
import com.auditsift.core.model.SearchResult;
import com.auditsift.core.model.SearchResults;
import com.auditsift.core.parallel.ExecutorKind;
import com.auditsift.core.parallel.InterruptController;
import com.auditsift.core.parallel.LoggingProgressTracker;
import com.auditsift.core.parallel.ParallelExecutionEngine;
import com.auditsift.core.parallel.SignalInterruptSource;
import com.auditsift.core.parallel.TaskResult;
import com.auditsift.core.search.SearchEngine;
import com.auditsift.core.util.ProgressListener;
import com.auditsift.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * 실행 오케스트레이터:
 *  - 설정 로드 → 시스템 분류 → 적용 규칙 선별 → (규칙 × 시스템) 작업 단위 병렬 실행 → 규칙별 재조립
 *  - 설정 오류는 스캔 전에 ConfigException 으로 중단
 *  - 인터럽트로 끊긴 실행은 요약에 단계가 남고 결과는 부분 결과
 *  - DI 생성자는 테스트 주입용
 */
public final class AuditRunService {

    private static final Logger LOG = LoggerFactory.getLogger(AuditRunService.class);
    private static final StructuredLog SLOG = StructuredLog.get(AuditRunService.class);

    private final SystemClassifier classifier;
    private final ISearchEngine engine;
    private final IFileDiscovery discovery;
    private final InterruptController interrupts;

    private volatile ProgressListener listener = ProgressListener.NONE;

    /** 기본 구현 */
    public AuditRunService() {
        this(new SystemClassifier(), new SearchEngine(), new GlobFileDiscovery(), new InterruptController());
    }

    /** DI/테스트용 */
    public AuditRunService(SystemClassifier classifier, ISearchEngine engine,
                           IFileDiscovery discovery, InterruptController interrupts) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.discovery = Objects.requireNonNull(discovery, "discovery");
        this.interrupts = Objects.requireNonNull(interrupts, "interrupts");
    }

    public void setProgressListener(ProgressListener l) {
        this.listener = (l != null) ? l : ProgressListener.NONE;
    }

    public InterruptController getInterrupts() { return interrupts; }

    /** 설정 파일 기준 실행: 파일 탐색 + (옵션) 시그널 핸들러 설치 */
    public AuditRun run(AuditSettings settings) throws ConfigException, IOException {
        settings.validate();
        List<Path> files = discovery.discover(settings.getSourceDir(), settings.getFilePattern(), settings.isRecursive());
        LOG.info("Discovered {} audit files under {}", files.size(), settings.getSourceDir());

        if (!settings.isInstallSignalHandlers()) {
            return execute(files, settings.getConfigFile(), settings.getMaxWorkers(),
                    settings.getExecutor(), settings.getBatchSize());
        }
        try (SignalInterruptSource signals = new SignalInterruptSource(interrupts)) {
            signals.install();
            return execute(files, settings.getConfigFile(), settings.getMaxWorkers(),
                    settings.getExecutor(), settings.getBatchSize());
        }
    }

    /** 파일 목록을 직접 지정 (워커/배치는 기본값) */
    public AuditRun run(List<Path> files, Path configFile) throws ConfigException {
        AuditSettings d = AuditSettings.defaults();
        return execute(files, configFile, d.getMaxWorkers(), d.getExecutor(), d.getBatchSize());
    }

    /**
     * 실행이 끝나면(예외 포함) 인터럽트 단계를 0 으로 되돌려 같은 서비스로 다음 실행이 가능하다.
     * 실행 시작 전에 들어온 인터럽트는 이번 실행에 적용된다.
     *
     * @throws ConfigException 규칙 설정이 잘못된 경우 (스캔 전)
     * @throws java.util.concurrent.CancellationException 3단계(즉시 종료) 인터럽트
     */
    public AuditRun execute(List<Path> files, Path configFile, int maxWorkers,
                            ExecutorKind kind, int batchSize) throws ConfigException {
        try {
            return executeOnce(files, configFile, maxWorkers, kind, batchSize);
        } finally {
            interrupts.reset();
        }
    }

    private AuditRun executeOnce(List<Path> files, Path configFile, int maxWorkers,
                                 ExecutorKind kind, int batchSize) throws ConfigException {
        Objects.requireNonNull(files, "files");
        Objects.requireNonNull(configFile, "configFile");
        final Instant started = Instant.now();
        final long t0 = System.nanoTime();

        // ---- 1) 규칙 로드 (실패 시 스캔 없이 중단) ----
        List<SearchConfig> configs = SearchConfigLoader.load(configFile);

        // ---- 2) 시스템 분류 ----
        List<AuditSystem> systems = classifier.classifyAll(files, listener);

        // ---- 3) 적용 가능한 규칙만 ----
        List<SearchConfig> applicable = engine.filterApplicableSearches(configs, systems);
        LOG.info("{} of {} searches apply to {} systems", applicable.size(), configs.size(), systems.size());

        // ---- 4) 작업 단위 (규칙 순서 × 시스템 순서) ----
        List<WorkUnit> units = new ArrayList<>();
        for (int ci = 0; ci < applicable.size(); ci++) {
            SearchConfig c = applicable.get(ci);
            for (AuditSystem s : SystemFilterEvaluator.filterSystems(systems, c.getSysFilter())) {
                units.add(new WorkUnit(ci, c, s, engine));
            }
        }

        // ---- 5) 병렬 실행 ----
        List<TaskResult<List<SearchResult>>> done = List.of();
        if (!units.isEmpty()) {
            ParallelExecutionEngine parallel = new ParallelExecutionEngine(
                    maxWorkers, kind, interrupts.token(), new LoggingProgressTracker(listener));
            done = parallel.executeWithBatching(units, batchSize, "Searching");
        }

        // ---- 6) 규칙별 재조립 (시스템 순서 유지, unique 적용) ----
        List<List<SearchResult>> perConfig = new ArrayList<>(applicable.size());
        for (int i = 0; i < applicable.size(); i++) perConfig.add(new ArrayList<>());
        int failed = 0;
        for (TaskResult<List<SearchResult>> r : done) {
            if (r.isSuccess()) {
                perConfig.get(units.get(r.getIndex()).configIndex()).addAll(r.getResult());
            } else {
                failed++;
            }
        }

        List<SearchResults> results = new ArrayList<>(applicable.size());
        List<RunSummary.SearchCount> counts = new ArrayList<>(applicable.size());
        for (int i = 0; i < applicable.size(); i++) {
            SearchResults sr = SearchEngine.assemble(applicable.get(i), perConfig.get(i));
            results.add(sr);
            counts.add(new RunSummary.SearchCount(sr.config().getName(), sr.count()));
        }

        // ---- 7) 요약 ----
        int stage = interrupts.level();
        RunSummary summary = new RunSummary(systems.size(), files.size() - systems.size(),
                configs.size(), applicable.size(), counts, stage, failed,
                Duration.ofNanos(System.nanoTime() - t0));

        if (summary.isPartial()) {
            LOG.warn("Run interrupted at stage {}: results are partial ({})", stage, summary);
        } else {
            LOG.info("Run complete: {}", summary);
        }
        SLOG.info("run-done",
                "systems", summary.getSystemsClassified(),
                "searches", summary.getSearchesExecuted(),
                "units", units.size(),
                "matches", summary.getTotalMatches(),
                "failedUnits", failed,
                "interruptStage", stage,
                "elapsedMs", summary.getElapsed().toMillis());
        return new AuditRun(results, systems, summary, started);
    }

    /** 규칙 1개 × 시스템 1대 */
    record WorkUnit(int configIndex, SearchConfig config, AuditSystem system, ISearchEngine engine)
            implements Callable<List<SearchResult>> {
        @Override
        public List<SearchResult> call() {
            return engine.searchSystem(config, system);
        }
    }
}
