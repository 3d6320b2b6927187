package com.auditsift.core.service.export;

import com.auditsift.core.service.AuditRun;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** 실행 결과를 파일로 내보내는 책임 (OS 계열별 1개 파일) */
public interface ResultExporter {
    /**
     * @param baseDir 출력 루트 (null이면 "results")
     * @param run     실행 결과
     * @return 생성된 파일 경로 (OS 계열 순서)
     */
    List<Path> export(Path baseDir, AuditRun run) throws IOException;
}
