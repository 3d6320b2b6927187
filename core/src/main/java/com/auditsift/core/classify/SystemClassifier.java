package com.auditsift.core.classify;

import com.auditsift.core.api.IEncodingDetector;
import com.auditsift.core.api.IFileHasher;
import com.auditsift.core.api.ISystemClassifier;
import com.auditsift.core.io.AuditFiles;
import com.auditsift.core.io.BomEncodingDetector;
import com.auditsift.core.io.Sha256FileHasher;
import com.auditsift.core.model.AuditSystem;
import com.auditsift.core.model.DistroFamily;
import com.auditsift.core.model.OsFamily;
import com.auditsift.core.model.ProducerType;
import com.auditsift.core.util.ProgressListener;
import com.auditsift.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * 감사 덤프 → AuditSystem.
 *  - 한 번의 순차 스캔, 필요한 값이 다 모이면 조기 종료
 *  - 수집기 서명이 없으면 empty (호출 측에서 파일 건너뜀)
 *  - 해시는 주입된 IFileHasher 로 계산
 */
public final class SystemClassifier implements ISystemClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(SystemClassifier.class);
    private static final StructuredLog SLOG = StructuredLog.get(SystemClassifier.class);

    private final IEncodingDetector encodingDetector;
    private final IFileHasher hasher;

    /** 기본 구현 */
    public SystemClassifier() {
        this(new BomEncodingDetector(), new Sha256FileHasher());
    }

    /** DI/테스트용 */
    public SystemClassifier(IEncodingDetector encodingDetector, IFileHasher hasher) {
        this.encodingDetector = Objects.requireNonNull(encodingDetector, "encodingDetector");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
    }

    @Override
    public Optional<AuditSystem> classify(Path file, Charset encoding) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(encoding, "encoding");

        ProducerSignature.Hit producer = null;
        DistroFamily distro = null;
        Map<ProducerType, OsDetailTable> tables = new EnumMap<>(ProducerType.class);
        tables.put(ProducerType.KPWINAUDIT, OsDetailTable.windows());
        tables.put(ProducerType.KPNIXAUDIT, OsDetailTable.linux());
        tables.put(ProducerType.KPMACAUDIT, OsDetailTable.mac());

        try (BufferedReader r = AuditFiles.openReader(file, encoding)) {
            String line;
            while ((line = r.readLine()) != null) {
                if (producer == null) {
                    producer = ProducerSignature.detect(line).orElse(null);
                    if (producer != null) {
                        // 이후로는 해당 수집기 표만 채운다
                        tables.keySet().retainAll(List.of(producer.producer()));
                        continue;
                    }
                }
                for (OsDetailTable t : tables.values()) t.accept(line);
                if (distro == null) distro = DistroTable.classify(line);

                if (producer != null && isComplete(producer.producer(), tables.get(producer.producer()), distro)) {
                    break;
                }
            }
        }

        if (producer == null) {
            LOG.warn("Unknown producer, skipping file: {}", file);
            SLOG.warn("classify-skip", "file", file.toString(), "reason", "unknown-producer");
            return Optional.empty();
        }

        ProducerType type = producer.producer();
        OsFamily family = type.osFamily();
        OsDetailTable table = tables.get(type);

        AuditSystem system = AuditSystem.builder()
                .id(UUID.randomUUID())
                .name(stem(file))
                .file(file)
                .encoding(encoding)
                .fileHash(hasher.hash(file))
                .osFamily(family)
                .distroFamily(family == OsFamily.LINUX ? (distro != null ? distro : DistroFamily.OTHER) : null)
                .producer(type)
                .producerVersion(producer.version())
                .systemOs(table.displayName())
                .attributes(table.attributes())
                .build();

        if (system.getSystemOs() == null) {
            LOG.debug("No complete OS details in {} ({})", file, type);
        }
        LOG.debug("Classified {} -> {}", file, system);
        return Optional.of(system);
    }

    /**
     * 파일 목록 전체 분류. 인코딩 판별 불가/수집기 불명/I/O 오류 파일은 경고 후 제외.
     * @return 이름순 정렬된 시스템 목록
     */
    public List<AuditSystem> classifyAll(List<Path> files, ProgressListener listener) {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        List<AuditSystem> out = new ArrayList<>(files.size());
        int done = 0;
        for (Path f : files) {
            Optional<Charset> cs = encodingDetector.detect(f);
            if (cs.isEmpty()) {
                LOG.warn("Could not detect encoding, skipping file: {}", f);
                SLOG.warn("classify-skip", "file", f.toString(), "reason", "encoding");
            } else {
                try {
                    classify(f, cs.get()).ifPresent(out::add);
                } catch (IOException e) {
                    LOG.warn("Cannot read {} during classification: {}", f, e.toString());
                    SLOG.warn("classify-skip", "file", f.toString(), "reason", e.toString());
                }
            }
            done++;
            pl.onProgress((double) done / files.size(), "classify", done, files.size());
        }
        out.sort(Comparator.comparing(AuditSystem::getName));

        LOG.info("Classified {} of {} files", out.size(), files.size());
        SLOG.info("classify-done", "files", files.size(), "systems", out.size(), "skipped", files.size() - out.size());
        return out;
    }

    private static boolean isComplete(ProducerType type, OsDetailTable table, DistroFamily distro) {
        if (!table.isComplete()) return false;
        return type != ProducerType.KPNIXAUDIT || distro != null;
    }

    /** 확장자를 뺀 파일명 */
    static String stem(Path file) {
        String n = file.getFileName().toString();
        int dot = n.lastIndexOf('.');
        return (dot > 0) ? n.substring(0, dot) : n;
    }
}
