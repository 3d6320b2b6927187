package com.auditsift.core.config;

import com.auditsift.core.parallel.ExecutorKind;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * auditsift.yml 을 읽어 AuditSettings 로 변환.
 *
 * 예상 YAML 키:
 * sourceDir: "dumps"
 * filePattern: "*.txt"
 * recursive: false
 * configFile: "conf.d/audit-all.yaml"
 * parallel:
 *   maxWorkers: 8
 *   executor: threads | work_stealing
 *   batchSize: 0
 *   installSignalHandlers: true
 * output:
 *   dir: "results"
 *
 * 시스템 프로퍼티 -Dauditsift.maxWorkers / -Dauditsift.batchSize 가 파일 값보다 우선한다.
 * 상대 경로(sourceDir/configFile/output.dir)는 설정 파일 위치 기준으로 해석한다.
 */
public final class AuditSettingsLoader {

    private AuditSettingsLoader() {}

    public static AuditSettings loadDefault() throws ConfigException {
        return load(Path.of("auditsift.yml"));
    }

    public static AuditSettings load(Path yamlPath) throws ConfigException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new ConfigException("auditsift.yml not found at: " + yamlPath.toAbsolutePath());
        }
        Path base = yamlPath.toAbsolutePath().getParent();
        AuditSettings cfg = AuditSettings.defaults();

        try (InputStream in = Files.newInputStream(yamlPath)) {
            Object root = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);

            if (root instanceof Map<?, ?> map) {
                // 1) 평면 키
                setPath(map, "sourceDir", base, cfg::setSourceDir);
                setString(map, "filePattern", cfg::setFilePattern);
                setBoolean(map, "recursive", cfg::setRecursive);
                setPath(map, "configFile", base, cfg::setConfigFile);

                // 2) parallel.*
                if (map.get("parallel") instanceof Map<?, ?> par) {
                    setInt(par, "maxWorkers", cfg::setMaxWorkers);
                    setExecutor(par, "executor", cfg::setExecutor);
                    setInt(par, "batchSize", cfg::setBatchSize);
                    setBoolean(par, "installSignalHandlers", cfg::setInstallSignalHandlers);
                }

                // 3) output.dir
                if (map.get("output") instanceof Map<?, ?> output) {
                    setPath(output, "dir", base, cfg::setOutputDir);
                }
            }
            // 비어있거나 단순 스칼라면 defaults 유지
        } catch (IOException e) {
            throw new ConfigException("Cannot read settings: " + e.getMessage(), yamlPath.toString(), e);
        } catch (YAMLException | IllegalArgumentException e) {
            throw new ConfigException("Invalid settings: " + e.getMessage(), yamlPath.toString(), e);
        }

        // 4) 시스템 프로퍼티 오버라이드
        cfg.setMaxWorkers(sysInt("auditsift.maxWorkers", cfg.getMaxWorkers()));
        cfg.setBatchSize(sysInt("auditsift.batchSize", cfg.getBatchSize()));

        try {
            cfg.validate();
        } catch (RuntimeException e) {
            throw new ConfigException("Invalid settings: " + e.getMessage(), yamlPath.toString(), e);
        }
        return cfg;
    }

    // ------------ helpers ------------

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setPath(Map<?, ?> map, String key, Path base, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v == null) return;
        Path p = Path.of(String.valueOf(v));
        setter.accept(p.isAbsolute() || base == null ? p : base.resolve(p).normalize());
    }

    private static void setExecutor(Map<?, ?> map, String key, Consumer<ExecutorKind> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim().replace('-', '_').toUpperCase(Locale.ROOT);
        setter.accept(ExecutorKind.valueOf(s));
    }

    /** 시스템 정수 프로퍼티 파싱 유틸 */
    private static int sysInt(String key, int def) {
        try { return Integer.parseInt(System.getProperty(key, String.valueOf(def)).trim()); }
        catch (Exception e) { return def; }
    }
}
