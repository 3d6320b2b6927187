package com.auditsift.core.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** 기준 디렉토리에서 glob 패턴에 맞는 감사 덤프 파일 목록을 찾는다. */
@FunctionalInterface
public interface IFileDiscovery {
    List<Path> discover(Path basePath, String pattern, boolean recursive) throws IOException;
}
