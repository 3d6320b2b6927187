package com.auditsift.core.parallel;

/** 진행률 작업 테이블 계약 */
public interface ProgressTracker {

    /**
     * @param total       전체 단위 수 (> 0)
     * @param description 표시 문구 (공백 불가)
     * @return 작업 id
     */
    int track(int total, String description);

    /** @param advance 완료 증가분 (>= 0) */
    void update(int taskId, int advance);

    void complete(int taskId);

    ProgressTracker NONE = new ProgressTracker() {
        @Override public int track(int total, String description) { return 0; }
        @Override public void update(int taskId, int advance) {}
        @Override public void complete(int taskId) {}
    };
}
