package com.auditsift.core.parallel;

import com.auditsift.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 독립 작업 단위(인자 없는 Callable)를 워커 풀에 분배하고 제출 순서대로 결과를 돌려준다.
 *
 * 인터럽트 단계별 동작:
 *  - 1단계: 새 작업 제출 중단, 큐에서 아직 시작하지 않은 작업은 건너뜀, 진행 중 작업은 끝까지
 *  - 2단계: 진행 중 작업에 cancel(true) 요청, 이미 끝난 결과만 모아 반환
 *  - 3단계: 정리 없이 CancellationException
 * 작업 단위 실패는 TaskResult.failure 로 기록되고 다른 작업에 영향을 주지 않는다.
 */
public final class ParallelExecutionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ParallelExecutionEngine.class);
    private static final StructuredLog SLOG = StructuredLog.get(ParallelExecutionEngine.class);

    static final int TASKS_PER_WORKER = 6;
    static final int MAX_AUTO_BATCH = 100;
    private static final long POLL_MS = 100L;
    private static final long DRAIN_SECONDS = 30L;

    private final int maxWorkers;
    private final ExecutorFactory executors;
    private final CancellationToken token;
    private final ProgressTracker progress;

    public ParallelExecutionEngine(int maxWorkers) {
        this(maxWorkers, ExecutorKind.THREADS, CancellationToken.NONE, ProgressTracker.NONE);
    }

    public ParallelExecutionEngine(int maxWorkers, ExecutorKind kind, CancellationToken token, ProgressTracker progress) {
        this(maxWorkers, ExecutorFactory.of(Objects.requireNonNull(kind, "kind")), token, progress);
    }

    /** DI/테스트용 */
    public ParallelExecutionEngine(int maxWorkers, ExecutorFactory executors, CancellationToken token, ProgressTracker progress) {
        if (maxWorkers <= 0) throw new IllegalArgumentException("maxWorkers must be > 0, got " + maxWorkers);
        this.maxWorkers = maxWorkers;
        this.executors = Objects.requireNonNull(executors, "executors");
        this.token = (token != null) ? token : CancellationToken.NONE;
        this.progress = (progress != null) ? progress : ProgressTracker.NONE;
    }

    public int getMaxWorkers() { return maxWorkers; }

    public CancellationToken getToken() { return token; }

    /* =========================
       실행 API
       ========================= */

    /** 모든 작업을 한 번에 제출. 결과는 제출 순서, 건너뛴/취소된 작업은 빠진다. */
    public <T> List<TaskResult<T>> executeInParallel(List<? extends Callable<T>> tasks, String description) {
        requireTasks(tasks);
        int pid = progress.track(tasks.size(), description);
        ExecutorService exec = executors.create(Math.min(maxWorkers, tasks.size()));
        LOG.debug("{}: {} tasks on {} workers", description, tasks.size(), maxWorkers);
        try {
            List<TaskResult<T>> out = runChunk(exec, tasks, 0, pid);
            logDone(description, tasks.size(), out);
            return out;
        } finally {
            shutdown(exec);
            progress.complete(pid);
        }
    }

    /**
     * 작업 목록을 배치로 나눠 동시에 떠 있는 Future 수를 제한한다.
     * @param batchSize 0 이하면 자동: max(1, ceil(n / (workers*6))), 상한 min(100, n)
     */
    public <T> List<TaskResult<T>> executeWithBatching(List<? extends Callable<T>> tasks, int batchSize, String description) {
        requireTasks(tasks);
        final int n = tasks.size();
        final int size = (batchSize > 0) ? batchSize : autoBatchSize(n, maxWorkers);
        int pid = progress.track(n, description);
        ExecutorService exec = executors.create(Math.min(maxWorkers, n));
        LOG.debug("{}: {} tasks in batches of {} on {} workers", description, n, size, maxWorkers);

        List<TaskResult<T>> out = new ArrayList<>(n);
        try {
            for (int start = 0; start < n; start += size) {
                if (token.isCancellationRequested()) {
                    LOG.warn("{}: cancellation requested, {} queued tasks not started", description, n - start);
                    break;
                }
                int end = Math.min(n, start + size);
                out.addAll(runChunk(exec, tasks.subList(start, end), start, pid));

                if (token.isImmediateExit()) throw new CancellationException("Execution interrupted");
                if (token.isTerminationRequested()) break;
            }
        } finally {
            shutdown(exec);
            progress.complete(pid);
        }
        out.sort(Comparator.comparingInt(TaskResult::getIndex));
        logDone(description, n, out);
        return out;
    }

    /** 성공한 결과의 payload 만 (순서 유지) */
    public static <T> List<T> successfulResults(List<TaskResult<T>> results) {
        List<T> out = new ArrayList<>(results.size());
        for (TaskResult<T> r : results) {
            if (r.isSuccess()) out.add(r.getResult());
        }
        return out;
    }

    static int autoBatchSize(int taskCount, int workers) {
        int perWave = Math.max(1, workers) * TASKS_PER_WORKER;
        int size = Math.max(1, (taskCount + perWave - 1) / perWave);
        return Math.min(size, Math.min(MAX_AUTO_BATCH, Math.max(1, taskCount)));
    }

    /* =========================
       내부 구현
       ========================= */

    private <T> List<TaskResult<T>> runChunk(ExecutorService exec, List<? extends Callable<T>> tasks,
                                             int baseIndex, int pid) {
        // ---- 1) 제출 (1단계 이상이면 중단) ----
        final List<Future<T>> futures = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            if (token.isCancellationRequested()) {
                LOG.warn("Cancellation requested: {} tasks not submitted", tasks.size() - i);
                break;
            }
            try {
                futures.add(exec.submit(guarded(tasks.get(i))));
            } catch (RejectedExecutionException e) {
                LOG.warn("Task submission rejected: {}", e.getMessage());
                break;
            }
        }

        // ---- 2) 제출 순서대로 수집 ----
        final List<TaskResult<T>> out = new ArrayList<>(futures.size());
        boolean terminating = false;
        for (int i = 0; i < futures.size(); i++) {
            checkImmediateExit(futures);
            Future<T> f = futures.get(i);

            if (!terminating && !awaitDone(f)) {
                terminating = true;
                int cancelled = cancelPending(futures, i);
                LOG.warn("Termination requested: cancelled {} active or queued tasks", cancelled);
                checkImmediateExit(futures);
            }
            if (terminating && (f.isCancelled() || !f.isDone())) continue;

            TaskResult<T> r = collect(f, baseIndex + i);
            if (r != null) {
                out.add(r);
                progress.update(pid, 1);
            }
        }
        return out;
    }

    /** 큐에서 꺼내질 때 이미 1단계 이상이면 실행하지 않는다. */
    private <T> Callable<T> guarded(Callable<T> task) {
        Objects.requireNonNull(task, "task");
        return () -> {
            if (token.isCancellationRequested()) {
                throw new CancellationException("Skipped: cancellation requested before start");
            }
            return task.call();
        };
    }

    /** 완료되면 true, 그 전에 2단계 이상이 되면 false */
    private boolean awaitDone(Future<?> f) {
        while (!f.isDone()) {
            if (token.isTerminationRequested()) return false;
            try {
                f.get(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException | ExecutionException | CancellationException e) {
                LOG.trace("Polling task: {}", e.getClass().getSimpleName());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while collecting results");
            }
        }
        return true;
    }

    /** 완료된 Future → TaskResult. 건너뛴/취소된 작업은 null. */
    private <T> TaskResult<T> collect(Future<T> f, int index) {
        try {
            T value = f.get();
            if (value == null) {
                return TaskResult.failure(index, new IllegalStateException("Task returned no result"));
            }
            return TaskResult.success(index, value);
        } catch (CancellationException ce) {
            return null;
        } catch (ExecutionException e) {
            Throwable cause = (e.getCause() != null ? e.getCause() : e);
            if (cause instanceof CancellationException) return null;
            LOG.warn("Task #{} failed: {}", index, cause.toString());
            SLOG.error("task-failed", cause, "index", index, "cause", cause.toString());
            return TaskResult.failure(index, cause);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while collecting results");
        }
    }

    private static int cancelPending(List<? extends Future<?>> futures, int from) {
        int n = 0;
        for (int k = from; k < futures.size(); k++) {
            Future<?> f = futures.get(k);
            if (!f.isDone() && f.cancel(true)) n++;
        }
        return n;
    }

    private void checkImmediateExit(List<? extends Future<?>> futures) {
        if (token.isImmediateExit()) {
            cancelPending(futures, 0);
            throw new CancellationException("Execution interrupted");
        }
    }

    private void shutdown(ExecutorService exec) {
        exec.shutdownNow();
        if (token.isImmediateExit()) return;
        try {
            long wait = token.isTerminationRequested() ? 1L : DRAIN_SECONDS;
            if (!exec.awaitTermination(wait, TimeUnit.SECONDS)) {
                LOG.warn("Workers still running after shutdown; abandoning them");
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private static void requireTasks(List<?> tasks) {
        if (tasks == null || tasks.isEmpty()) throw new IllegalArgumentException("tasks must not be empty");
    }

    private <T> void logDone(String description, int total, List<TaskResult<T>> out) {
        long failed = out.stream().filter(r -> !r.isSuccess()).count();
        InterruptStage st = token.stage();
        if (st != InterruptStage.NORMAL) {
            LOG.warn("{}: partial results after interrupt (stage {}): {}/{} collected, {} failed",
                    description, st.level(), out.size(), total, failed);
        } else {
            LOG.info("{}: {}/{} collected, {} failed", description, out.size(), total, failed);
        }
        SLOG.info("parallel-done",
                "description", description,
                "total", total,
                "collected", out.size(),
                "failed", failed,
                "stage", st.level());
    }
}
