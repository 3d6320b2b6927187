package com.auditsift.core.api;

import java.io.IOException;
import java.nio.file.Path;

/** 파일 내용 해시(소문자 hex) */
@FunctionalInterface
public interface IFileHasher {
    String hash(Path file) throws IOException;
}
