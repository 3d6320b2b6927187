package com.auditsift.core.config;

import com.auditsift.core.model.FilterAttribute;
import com.auditsift.core.model.FilterOperator;
import com.auditsift.core.model.GlobalConfig;
import com.auditsift.core.model.MergeFieldRule;
import com.auditsift.core.model.SearchConfig;
import com.auditsift.core.model.SystemFilter;
import com.auditsift.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * 검색 규칙 YAML 을 읽어 평탄화된 SearchConfig 목록으로 변환.
 *
 * 예상 YAML 구조:
 * <pre>
 * global:
 *   sys_filter:
 *     - attr: os_family
 *       comp: eq
 *       value: Windows
 *
 * include_system:
 *   files:
 *     - "audit-windows-system.yaml"
 *
 * 01_system_01_kp_win_version:
 *   regex: 'System_PSDetails::KPWINVERSION: (?P&lt;kp_win_version&gt;\d+\.\d+\.\d+)'
 *   max_results: 1
 *   field_list: [kp_win_version]
 * </pre>
 *
 * global 은 같은 파일의 규칙에만 적용되고 include 된 파일에는 넘어가지 않는다.
 * include 경로는 include 하는 파일 기준 상대경로(절대경로는 그대로).
 */
public final class SearchConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SearchConfigLoader.class);
    private static final StructuredLog SLOG = StructuredLog.get(SearchConfigLoader.class);

    static final String GLOBAL_KEY = "global";
    static final String INCLUDE_PREFIX = "include_";

    private static final Set<String> SEARCH_KEYS = Set.of(
            "regex", "comment", "excel_sheet_name", "max_results", "field_list", "only_matching",
            "unique", "full_scan", "rs_delimiter", "multiline", "merge_fields", "sys_filter");

    private SearchConfigLoader() {}

    public static List<SearchConfig> load(Path yamlPath) throws ConfigException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.isRegularFile(yamlPath)) {
            throw new ConfigException("Config file not found: " + yamlPath.toAbsolutePath());
        }
        List<SearchConfig> configs = loadFile(yamlPath, new LinkedHashSet<>());

        for (String w : SheetNameValidator.validate(configs)) {
            LOG.warn("Config warning: {}", w);
        }
        LOG.info("Loaded {} search configs from {}", configs.size(), yamlPath);
        SLOG.info("config-loaded", "file", yamlPath.toString(), "searches", configs.size());
        return configs;
    }

    // ------------ 파일 단위 재귀 ------------

    /**
     * @param chain 현재 로딩 중인 파일들(조상 경로). include 가 여기로 되돌아오면 순환.
     */
    private static List<SearchConfig> loadFile(Path file, Set<Path> chain) throws ConfigException {
        Path key = canonical(file);
        chain.add(key);
        try {
            Map<?, ?> root = readYaml(file);
            if (root == null) {
                LOG.info("Config file is empty: {}", file);
                return new ArrayList<>();
            }

            // ---- 1) global ----
            GlobalConfig global = parseGlobal(root.get(GLOBAL_KEY), file);

            // ---- 2) 이 파일의 규칙 + include 목록 ----
            List<SearchConfig> out = new ArrayList<>();
            List<Path> includes = new ArrayList<>();
            for (Map.Entry<?, ?> e : root.entrySet()) {
                String name = String.valueOf(e.getKey());
                if (GLOBAL_KEY.equals(name)) continue;
                if (name.startsWith(INCLUDE_PREFIX)) {
                    includes.addAll(parseInclude(name, e.getValue(), file));
                    continue;
                }
                SearchConfig local = parseSearch(name, e.getValue(), file);
                out.add(merge(local, global, file));
            }

            // ---- 3) include 재귀 (순서 유지, 결과는 뒤에 붙임) ----
            Path baseDir = file.toAbsolutePath().getParent();
            for (Path inc : includes) {
                Path resolved = inc.isAbsolute() ? inc : baseDir.resolve(inc).normalize();
                out.addAll(loadInclude(resolved, file, chain));
            }
            return out;
        } finally {
            chain.remove(key);
        }
    }

    private static List<SearchConfig> loadInclude(Path include, Path from, Set<Path> chain) throws ConfigException {
        if (!Files.isRegularFile(include)) {
            LOG.warn("Include file not found, skipping: {} (included from {})", include, from);
            SLOG.warn("include-missing", "file", include.toString(), "from", from.toString());
            return List.of();
        }
        try {
            if (chain.contains(canonical(include))) {
                LOG.warn("Include cycle detected, skipping: {} (included from {})", include, from);
                SLOG.warn("include-cycle", "file", include.toString(), "from", from.toString());
                return List.of();
            }
            List<SearchConfig> loaded = loadFile(include, chain);
            LOG.debug("Included {} search configs from {}", loaded.size(), include);
            return loaded;
        } catch (ConfigException e) {
            // include 안의 오류(읽기 실패, 잘못된 규칙)는 그 파일만 버린다. 루트 파일 오류는 호출자에게 전파.
            LOG.warn("Malformed include, skipping: {} ({})", include, e.getMessage());
            SLOG.warn("include-malformed", "file", include.toString(), "reason", e.getMessage());
            return List.of();
        }
    }

    private static Map<?, ?> readYaml(Path file) throws ConfigException {
        try (InputStream in = Files.newInputStream(file)) {
            LoaderOptions opts = new LoaderOptions();
            opts.setAllowDuplicateKeys(false);
            Yaml yaml = new Yaml(new SafeConstructor(opts));
            Object root = yaml.load(in);
            if (root == null) return null;
            if (!(root instanceof Map<?, ?> map)) {
                throw new ConfigException("Config root must be a mapping", file.toString(), null);
            }
            return map;
        } catch (IOException e) {
            throw new ConfigException("Cannot read config file: " + e.getMessage(), file.toString(), e);
        } catch (YAMLException e) {
            throw new ConfigException("Malformed YAML: " + e.getMessage(), file.toString(), e);
        }
    }

    private static Path canonical(Path file) throws ConfigException {
        try {
            return file.toRealPath();
        } catch (IOException e) {
            throw new ConfigException("Cannot resolve config path: " + e.getMessage(), file.toString(), e);
        }
    }

    // ------------ 블록 파서 ------------

    private static GlobalConfig parseGlobal(Object node, Path file) throws ConfigException {
        if (node == null) return GlobalConfig.EMPTY;
        if (!(node instanceof Map<?, ?> m)) {
            throw new ConfigException("'global' must be a mapping", file.toString(), null);
        }
        try {
            GlobalConfig g = new GlobalConfig();
            Object filters = m.get("sys_filter");
            if (filters != null) g.setSysFilter(parseFilters(filters));
            Object max = m.get("max_results");
            if (max != null) g.setMaxResults(toInt(max));
            Object om = m.get("only_matching");
            if (om != null) g.setOnlyMatching(toBool(om));
            Object uq = m.get("unique");
            if (uq != null) g.setUnique(toBool(uq));
            Object fs = m.get("full_scan");
            if (fs != null) g.setFullScan(toBool(fs));
            g.validate();
            return g;
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid 'global' block: " + e.getMessage(), file.toString(), e);
        }
    }

    private static List<Path> parseInclude(String key, Object node, Path file) {
        Object files = (node instanceof Map<?, ?> m) ? m.get("files") : null;
        if (!(files instanceof List<?> list)) {
            LOG.warn("Include block '{}' in {} has no 'files' list, skipping", key, file);
            return List.of();
        }
        List<Path> out = new ArrayList<>();
        for (Object o : list) {
            if (o != null && !String.valueOf(o).isBlank()) out.add(Path.of(String.valueOf(o).trim()));
        }
        return out;
    }

    static SearchConfig parseSearch(String name, Object node, Path file) throws ConfigException {
        if (!(node instanceof Map<?, ?> map)) {
            throw new ConfigException("Search '" + name + "' must be a mapping", file.toString(), null);
        }
        for (Object k : map.keySet()) {
            if (!SEARCH_KEYS.contains(String.valueOf(k))) {
                LOG.warn("Unknown key '{}' in search '{}' ({})", k, name, file);
            }
        }
        try {
            SearchConfig.Builder b = SearchConfig.builder(name);
            setString(map, "regex", b::regex);
            setString(map, "comment", b::comment);
            setString(map, "excel_sheet_name", b::excelSheetName);
            setInt(map, "max_results", b::maxResults);
            setStringList(map, "field_list", b::fieldList);
            setBoolean(map, "only_matching", b::onlyMatching);
            setBoolean(map, "unique", b::unique);
            setBoolean(map, "full_scan", b::fullScan);
            setBoolean(map, "multiline", b::multiline);
            setString(map, "rs_delimiter", b::rsDelimiter);

            Object merges = map.get("merge_fields");
            if (merges != null) b.mergeFields(parseMergeFields(merges));
            Object filters = map.get("sys_filter");
            if (filters != null) b.sysFilter(parseFilters(filters));

            return b.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid search '" + name + "': " + e.getMessage(), file.toString(), e);
        }
    }

    private static SearchConfig merge(SearchConfig local, GlobalConfig global, Path file) throws ConfigException {
        try {
            return local.withGlobal(global);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Cannot apply 'global' to search '" + local.getName() + "': "
                    + e.getMessage(), file.toString(), e);
        }
    }

    static List<SystemFilter> parseFilters(Object node) {
        if (!(node instanceof List<?> list)) {
            throw new IllegalArgumentException("sys_filter must be a list");
        }
        List<SystemFilter> out = new ArrayList<>();
        for (Object o : list) {
            if (!(o instanceof Map<?, ?> f)) {
                throw new IllegalArgumentException("sys_filter entries must be mappings with attr/comp/value");
            }
            FilterAttribute attr = FilterAttribute.fromValue(requireString(f, "attr"));
            FilterOperator comp = FilterOperator.fromValue(requireString(f, "comp"));
            out.add(SystemFilter.of(attr, comp, f.get("value")));
        }
        return out;
    }

    private static List<MergeFieldRule> parseMergeFields(Object node) {
        if (!(node instanceof List<?> list)) {
            throw new IllegalArgumentException("merge_fields must be a list");
        }
        List<MergeFieldRule> out = new ArrayList<>();
        for (Object o : list) {
            if (!(o instanceof Map<?, ?> m) || !(m.get("source_columns") instanceof List<?> src)) {
                throw new IllegalArgumentException("merge_fields entries need source_columns and dest_column");
            }
            List<String> cols = new ArrayList<>();
            for (Object c : src) if (c != null) cols.add(String.valueOf(c));
            Object dest = m.get("dest_column");
            out.add(new MergeFieldRule(cols, dest == null ? null : String.valueOf(dest)));
        }
        return out;
    }

    // ------------ helpers ------------

    private static String requireString(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v == null) throw new IllegalArgumentException("sys_filter entry is missing '" + key + "'");
        return String.valueOf(v);
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof List<?> list) {
            List<String> out = new ArrayList<>();
            for (Object o : list) if (o != null) out.add(String.valueOf(o).trim());
            setter.accept(List.copyOf(out));
            return;
        }
        // "a,b,c" 형태 지원
        String s = String.valueOf(v).trim();
        if (!s.isEmpty()) setter.accept(List.of(s.split("\\s*,\\s*")));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(toBool(v));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(toInt(v));
    }

    private static boolean toBool(Object v) {
        if (v instanceof Boolean b) return b;
        return Boolean.parseBoolean(String.valueOf(v).trim());
    }

    private static int toInt(Object v) {
        if (v instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected an integer but got '" + v + "'");
        }
    }
}
