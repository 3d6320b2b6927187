package com.auditsift.core.api;

import com.auditsift.core.model.AuditSystem;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.Optional;

/** 분류기 최소 계약: 알 수 없는 수집기면 empty (해당 파일은 건너뜀). */
public interface ISystemClassifier {
    Optional<AuditSystem> classify(Path file, Charset encoding) throws IOException;
}
