package com.auditsift.core.model;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/** 분류가 끝난 감사 덤프 1개 (= 점검 대상 호스트 1대). 생성 후 불변. */
public final class AuditSystem {

    /** OS 상세 속성 키 */
    public static final String PRODUCT_NAME = "product_name";
    public static final String RELEASE_ID = "release_id";
    public static final String CURRENT_BUILD = "current_build";
    public static final String UBR = "ubr";
    public static final String OS_PRETTY_NAME = "os_pretty_name";
    public static final String OS_VERSION = "os_version";
    public static final String PRODUCT_VERSION = "product_version";
    public static final String BUILD_VERSION = "build_version";

    private final UUID id;
    private final String name;
    private final Path file;
    private final Charset encoding;
    private final String fileHash;
    private final OsFamily osFamily;
    private final DistroFamily distroFamily;   // Linux 외에는 null
    private final ProducerType producer;
    private final String producerVersion;
    private final String systemOs;             // 표시용, 추출 실패 시 null
    private final Map<String, String> attributes;

    private AuditSystem(Builder b) {
        this.id = (b.id == null ? UUID.randomUUID() : b.id);
        this.name = b.name;
        this.file = b.file.toAbsolutePath();
        this.encoding = b.encoding;
        this.fileHash = b.fileHash;
        this.osFamily = (b.osFamily == null ? OsFamily.UNDEFINED : b.osFamily);
        this.distroFamily = (this.osFamily == OsFamily.LINUX ? b.distroFamily : null);
        this.producer = (b.producer == null ? ProducerType.OTHER : b.producer);
        this.producerVersion = (b.producerVersion == null ? "Unknown" : b.producerVersion);
        this.systemOs = b.systemOs;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(b.attributes));
    }

    public UUID getId() { return id; }
    public String getName() { return name; }
    public Path getFile() { return file; }
    public Charset getEncoding() { return encoding; }
    public String getFileHash() { return fileHash; }
    public OsFamily getOsFamily() { return osFamily; }
    public DistroFamily getDistroFamily() { return distroFamily; }
    public ProducerType getProducer() { return producer; }
    public String getProducerVersion() { return producerVersion; }
    public String getSystemOs() { return systemOs; }
    public Map<String, String> getAttributes() { return attributes; }

    /** OS 상세 속성 (없으면 null) */
    public String attribute(String key) { return attributes.get(key); }

    @Override
    public String toString() {
        return "AuditSystem{" + name + ", " + osFamily + ", " + producer + " " + producerVersion + "}";
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private UUID id;
        private String name;
        private Path file;
        private Charset encoding;
        private String fileHash;
        private OsFamily osFamily;
        private DistroFamily distroFamily;
        private ProducerType producer;
        private String producerVersion;
        private String systemOs;
        private final Map<String, String> attributes = new LinkedHashMap<>();

        public Builder id(UUID id) { this.id = id; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder file(Path file) { this.file = file; return this; }
        public Builder encoding(Charset encoding) { this.encoding = encoding; return this; }
        public Builder fileHash(String fileHash) { this.fileHash = fileHash; return this; }
        public Builder osFamily(OsFamily osFamily) { this.osFamily = osFamily; return this; }
        public Builder distroFamily(DistroFamily distroFamily) { this.distroFamily = distroFamily; return this; }
        public Builder producer(ProducerType producer) { this.producer = producer; return this; }
        public Builder producerVersion(String producerVersion) { this.producerVersion = producerVersion; return this; }
        public Builder systemOs(String systemOs) { this.systemOs = systemOs; return this; }

        public Builder attribute(String key, String value) {
            if (key != null && value != null) attributes.put(key, value);
            return this;
        }

        public Builder attributes(Map<String, String> values) {
            if (values != null) values.forEach(this::attribute);
            return this;
        }

        public AuditSystem build() {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(file, "file");
            Objects.requireNonNull(encoding, "encoding");
            return new AuditSystem(this);
        }
    }
}
