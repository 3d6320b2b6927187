package com.auditsift.core.parallel;

/**
 * 3단계 인터럽트 상태. 신호 1회에 정확히 한 단계씩만 올라간다.
 */
public enum InterruptStage {
    NORMAL(0, null, null),
    CANCEL_QUEUED(1,
            "Interrupt received. Cancelling queued tasks and finishing active jobs...",
            "Press CTRL-C again to terminate active jobs immediately."),
    TERMINATE_ACTIVE(2,
            "Second interrupt received. Terminating active tasks...",
            "Press CTRL-C again to exit immediately without cleanup."),
    IMMEDIATE_EXIT(3,
            "Third interrupt received. Exiting immediately without cleanup.",
            null);

    private final int level;
    private final String message;
    private final String nextHint;

    InterruptStage(int level, String message, String nextHint) {
        this.level = level;
        this.message = message;
        this.nextHint = nextHint;
    }

    public int level() { return level; }

    /** 이 단계로 들어올 때 사용자에게 보여줄 문구 */
    public String message() { return message; }

    /** 다음 인터럽트의 효과 안내 (마지막 단계는 null) */
    public String nextHint() { return nextHint; }

    public static InterruptStage of(int level) {
        InterruptStage[] all = values();
        return all[Math.max(0, Math.min(level, all.length - 1))];
    }
}
