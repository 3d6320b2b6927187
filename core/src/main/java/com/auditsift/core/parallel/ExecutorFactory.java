package com.auditsift.core.parallel;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/** 실행기 생성 (I/O 세부와 분리). 호출 측이 shutdown 책임을 진다. */
@FunctionalInterface
public interface ExecutorFactory {

    ExecutorService create(int maxWorkers);

    static ExecutorFactory of(ExecutorKind kind) {
        return switch (kind) {
            case THREADS -> ExecutorFactory::threadPool;
            case WORK_STEALING -> Executors::newWorkStealingPool;
        };
    }

    /**
     * 고정 스레드풀(+역압): 큐가 차면 제출 스레드가 자리가 날 때까지 대기한다.
     */
    static ExecutorService threadPool(int maxWorkers) {
        int cc = Math.max(1, maxWorkers);
        return new ThreadPoolExecutor(
                cc, cc,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(cc * 2),
                new NamedThreadFactory("audit-worker"),
                (r, e) -> {
                    if (e.isShutdown()) throw new RejectedExecutionException("Executor is shut down");
                    try { e.getQueue().put(r); }
                    catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RejectedExecutionException("Interrupted while enqueueing", ie);
                    }
                }
        );
    }
}
