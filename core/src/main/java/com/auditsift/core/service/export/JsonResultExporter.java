package com.auditsift.core.service.export;

import static com.auditsift.core.service.export.ExportNaming.*;

import com.auditsift.core.model.AuditSystem;
import com.auditsift.core.model.FieldValue;
import com.auditsift.core.model.OsFamily;
import com.auditsift.core.model.RunSummary;
import com.auditsift.core.model.SearchResult;
import com.auditsift.core.model.SearchResults;
import com.auditsift.core.service.AuditRun;
import com.auditsift.core.util.StructuredLog;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * OS 계열별 JSON 결과 파일.
 * 구조: meta / systems / searches[ {name, comment, sheetName, count, results[]} ]
 * 추출 필드는 숫자면 JSON 숫자, NULL 이면 null 로 기록한다.
 */
public class JsonResultExporter implements ResultExporter {

    private static final Logger LOG = LoggerFactory.getLogger(JsonResultExporter.class);
    private static final StructuredLog SLOG = StructuredLog.get(JsonResultExporter.class);

    public static final String FORMAT_VERSION = "1";

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Override
    public List<Path> export(Path baseDir, AuditRun run) throws IOException {
        if (run == null) throw new IllegalArgumentException("run is null");
        var ctx = context(baseDir, run.getStartedAt());

        List<Path> written = new ArrayList<>();
        for (OsFamily family : run.osFamilies()) {
            Files.createDirectories(familyDir(ctx, family));
            Path outFile = jsonPath(ctx, family);
            om.writerWithDefaultPrettyPrinter().writeValue(outFile.toFile(), build(run, family));
            written.add(outFile);
            LOG.info("Exported {} results to {}", family, outFile);
        }
        SLOG.info("export-done", "dir", ctx.baseDir().toString(), "files", written.size());
        return written;
    }

    /** 패키지 내부/테스트용: 파일 없이 트리만 */
    ObjectNode build(AuditRun run, OsFamily family) {
        ObjectNode root = om.createObjectNode();

        // meta
        RunSummary s = run.getSummary();
        ObjectNode meta = root.putObject("meta");
        meta.put("formatVersion", FORMAT_VERSION);
        meta.putPOJO("generatedAt", Instant.now());
        meta.putPOJO("startedAt", run.getStartedAt());
        meta.put("osFamily", family.value());
        meta.put("partial", s.isPartial());
        meta.put("interruptStage", s.getInterruptStage());
        meta.put("failedUnits", s.getFailedUnits());

        // systems
        ArrayNode systems = root.putArray("systems");
        for (AuditSystem sys : run.getSystems()) {
            if (sys.getOsFamily() != family) continue;
            ObjectNode n = systems.addObject();
            n.put("name", sys.getName());
            n.put("file", sys.getFile().toString());
            n.put("encoding", sys.getEncoding().name());
            n.put("fileHash", sys.getFileHash());
            n.put("producer", sys.getProducer() == null ? null : sys.getProducer().value());
            n.put("producerVersion", sys.getProducerVersion());
            n.put("systemOs", sys.getSystemOs());
            if (sys.getDistroFamily() != null) n.put("distroFamily", sys.getDistroFamily().value());
            ObjectNode attrs = n.putObject("attributes");
            for (Map.Entry<String, String> e : sys.getAttributes().entrySet()) attrs.put(e.getKey(), e.getValue());
        }

        // searches
        ArrayNode searches = root.putArray("searches");
        for (SearchResults sr : run.resultsFor(family)) {
            ObjectNode n = searches.addObject();
            n.put("name", sr.config().getName());
            n.put("comment", sr.config().getComment());
            n.put("sheetName", sr.config().getExcelSheetName());
            n.put("count", sr.count());
            ArrayNode rows = n.putArray("results");
            for (SearchResult r : sr.results()) {
                ObjectNode row = rows.addObject();
                row.put("system", r.getSystemName());
                row.put("line", r.getLineNumber());
                row.put("matchedText", r.getMatchedText());
                if (r.hasExtractedFields()) {
                    ObjectNode fields = row.putObject("fields");
                    for (Map.Entry<String, FieldValue> e : r.getExtractedFields().entrySet()) {
                        putField(fields, e.getKey(), e.getValue());
                    }
                }
            }
        }
        return root;
    }

    private static void putField(ObjectNode node, String key, FieldValue v) {
        if (v == null || v.isNull()) node.putNull(key);
        else if (v.isNumber()) node.put(key, v.asNumber());
        else node.put(key, v.asText());
    }
}
