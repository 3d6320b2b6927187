package com.auditsift.core.parallel;

import com.auditsift.core.util.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * 로그 + ProgressListener 로 진행률을 내보내는 기본 구현.
 * 작업 테이블은 단일 락으로 보호하며 완료 수는 감소하지 않는다.
 */
public final class LoggingProgressTracker implements ProgressTracker {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingProgressTracker.class);
    private static final int LOG_STEPS = 10;   // 10% 단위로만 로그

    private final ProgressListener listener;
    private final Map<Integer, Task> tasks = new HashMap<>();
    private int nextId = 1;

    public LoggingProgressTracker() {
        this(ProgressListener.NONE);
    }

    public LoggingProgressTracker(ProgressListener listener) {
        this.listener = (listener != null) ? listener : ProgressListener.NONE;
    }

    private static final class Task {
        final String description;
        final int total;
        int done;
        int lastLoggedStep;

        Task(String description, int total) {
            this.description = description;
            this.total = total;
        }
    }

    @Override
    public int track(int total, String description) {
        if (total <= 0) throw new IllegalArgumentException("total must be > 0");
        if (description == null || description.isBlank()) throw new IllegalArgumentException("description must not be blank");
        int id;
        synchronized (tasks) {
            id = nextId++;
            tasks.put(id, new Task(description, total));
        }
        LOG.info("{}: 0/{}", description, total);
        notifyListener(description, 0, total);
        return id;
    }

    @Override
    public void update(int taskId, int advance) {
        if (advance < 0) throw new IllegalArgumentException("advance must be >= 0");
        String description;
        int done;
        int total;
        boolean logIt;
        synchronized (tasks) {
            Task t = tasks.get(taskId);
            if (t == null) return;
            t.done = Math.min(t.total, t.done + advance);
            int step = (int) ((long) t.done * LOG_STEPS / t.total);
            logIt = step > t.lastLoggedStep;
            if (logIt) t.lastLoggedStep = step;
            description = t.description;
            done = t.done;
            total = t.total;
        }
        if (logIt) LOG.info("{}: {}/{}", description, done, total);
        notifyListener(description, done, total);
    }

    @Override
    public void complete(int taskId) {
        Task t;
        synchronized (tasks) {
            t = tasks.remove(taskId);
        }
        if (t == null) return;
        LOG.info("{}: finished {}/{}", t.description, t.done, t.total);
        notifyListener(t.description, t.done, t.total);
    }

    /** 진행 중 작업의 완료 수 (없으면 -1) */
    public int completed(int taskId) {
        synchronized (tasks) {
            Task t = tasks.get(taskId);
            return (t == null) ? -1 : t.done;
        }
    }

    private void notifyListener(String description, int done, int total) {
        double p = (total <= 0) ? 0.0 : Math.max(0.0, Math.min(1.0, (double) done / total));
        try {
            listener.onProgress(p, description, done, total);
        } catch (RuntimeException e) {
            LOG.debug("Progress listener failed: {}", e.toString());
        }
    }
}
