package com.auditsift.core.parallel;

import java.util.Objects;

/**
 * 작업 단위 1개의 결과: 성공(payload) 또는 실패(error). 제출 순번(index)으로 재정렬한다.
 */
public final class TaskResult<T> {
    private final int index;
    private final T result;
    private final Throwable error;

    private TaskResult(int index, T result, Throwable error) {
        this.index = index;
        this.result = result;
        this.error = error;
    }

    public static <T> TaskResult<T> success(int index, T result) {
        Objects.requireNonNull(result, "result");
        return new TaskResult<>(index, result, null);
    }

    public static <T> TaskResult<T> failure(int index, Throwable error) {
        Objects.requireNonNull(error, "error");
        return new TaskResult<>(index, null, error);
    }

    public int getIndex() { return index; }
    public boolean isSuccess() { return error == null; }

    /** 실패 결과에서 호출하면 IllegalStateException */
    public T getResult() {
        if (error != null) {
            throw new IllegalStateException("Task " + index + " failed: " + error, error);
        }
        return result;
    }

    /** 성공 결과면 null */
    public Throwable getError() { return error; }

    @Override
    public String toString() {
        return isSuccess() ? "TaskResult#" + index + "{ok}" : "TaskResult#" + index + "{failed: " + error + "}";
    }
}
