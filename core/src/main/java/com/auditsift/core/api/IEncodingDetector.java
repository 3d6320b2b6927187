package com.auditsift.core.api;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.Optional;

/** 인코딩 감지 계약: 판별 불가면 empty. */
@FunctionalInterface
public interface IEncodingDetector {
    Optional<Charset> detect(Path file);
}
