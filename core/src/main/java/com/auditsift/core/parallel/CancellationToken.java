package com.auditsift.core.parallel;

/** 실행기에 전달되는 읽기 전용 취소 상태 */
public interface CancellationToken {

    InterruptStage stage();

    /** 1단계 이상: 새 작업 제출 중단 */
    default boolean isCancellationRequested() { return stage().level() >= 1; }

    /** 2단계 이상: 진행 중 작업 중단 요청 */
    default boolean isTerminationRequested() { return stage().level() >= 2; }

    /** 3단계: 정리 없이 즉시 종료 */
    default boolean isImmediateExit() { return stage().level() >= 3; }

    CancellationToken NONE = () -> InterruptStage.NORMAL;
}
