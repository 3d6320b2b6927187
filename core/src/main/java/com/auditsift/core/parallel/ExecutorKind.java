package com.auditsift.core.parallel;

/** 워커 풀 종류 */
public enum ExecutorKind {
    /** 고정 크기 스레드 풀 + 역압 큐 */
    THREADS,
    /** ForkJoin 기반 work-stealing 풀 (CPU 바운드 정규식 스캔용) */
    WORK_STEALING
}
