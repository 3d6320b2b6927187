package com.auditsift.core.config;

import com.auditsift.core.parallel.ExecutorKind;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 실행 설정 (auditsift.yml 매핑 대상). 순수 설정 보관용.
 * 검색 규칙 자체는 configFile 이 가리키는 YAML 에서 {@link SearchConfigLoader} 가 읽는다.
 */
public final class AuditSettings {

    // ---------- 입력 ----------
    private Path sourceDir = Path.of(".");
    private String filePattern = "*.txt";
    private boolean recursive = false;
    private Path configFile = Path.of("conf.d", "audit-all.yaml");

    // ---------- 병렬 실행 ----------
    private int maxWorkers = Runtime.getRuntime().availableProcessors();
    private ExecutorKind executor = ExecutorKind.THREADS;
    private int batchSize = 0;                  // 0 = 자동
    private boolean installSignalHandlers = false;

    // ---------- 출력 ----------
    private Path outputDir = Path.of("results");

    // ---------- getters ----------
    public Path getSourceDir() { return sourceDir; }
    public String getFilePattern() { return filePattern; }
    public boolean isRecursive() { return recursive; }
    public Path getConfigFile() { return configFile; }
    public int getMaxWorkers() { return maxWorkers; }
    public ExecutorKind getExecutor() { return executor; }
    public int getBatchSize() { return batchSize; }
    public boolean isInstallSignalHandlers() { return installSignalHandlers; }
    public Path getOutputDir() { return outputDir; }

    // ---------- fluent setters ----------
    public AuditSettings setSourceDir(Path sourceDir) { this.sourceDir = sourceDir; return this; }
    public AuditSettings setFilePattern(String filePattern) { this.filePattern = filePattern; return this; }
    public AuditSettings setRecursive(boolean recursive) { this.recursive = recursive; return this; }
    public AuditSettings setConfigFile(Path configFile) { this.configFile = configFile; return this; }
    public AuditSettings setMaxWorkers(int maxWorkers) { this.maxWorkers = Math.max(1, maxWorkers); return this; }
    public AuditSettings setExecutor(ExecutorKind executor) {
        this.executor = (executor != null ? executor : ExecutorKind.THREADS);
        return this;
    }
    public AuditSettings setBatchSize(int batchSize) { this.batchSize = Math.max(0, batchSize); return this; }
    public AuditSettings setInstallSignalHandlers(boolean v) { this.installSignalHandlers = v; return this; }
    public AuditSettings setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(sourceDir, "sourceDir");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(outputDir, "outputDir");
        if (filePattern == null || filePattern.isBlank()) throw new IllegalArgumentException("filePattern must not be blank");
        if (maxWorkers < 1) throw new IllegalArgumentException("maxWorkers must be >= 1");
        if (batchSize < 0) throw new IllegalArgumentException("batchSize must be >= 0");
    }

    public static AuditSettings defaults() { return new AuditSettings(); }
}
