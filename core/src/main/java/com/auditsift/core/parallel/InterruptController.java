package com.auditsift.core.parallel;

import com.auditsift.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * 3단계 인터럽트 상태 기계.
 *  - 상태는 AtomicInteger 하나 (신호 핸들러 스레드와 워커 스레드가 공유)
 *  - signal() 1회 = 정확히 한 단계 상승, 3에서 멈춤
 *  - 3단계 진입 시 exitHook 실행 (기본: Runtime.halt(1), 테스트에서는 교체)
 */
public final class InterruptController implements CancellationToken {

    private static final Logger LOG = LoggerFactory.getLogger(InterruptController.class);
    private static final StructuredLog SLOG = StructuredLog.get(InterruptController.class);

    public static final int EXIT_CODE = 1;

    private final AtomicInteger stage = new AtomicInteger(0);
    private final List<Consumer<InterruptStage>> listeners = new CopyOnWriteArrayList<>();
    private final Runnable exitHook;

    public InterruptController() {
        this(() -> Runtime.getRuntime().halt(EXIT_CODE));
    }

    public InterruptController(Runnable exitHook) {
        this.exitHook = Objects.requireNonNull(exitHook, "exitHook");
    }

    /**
     * 인터럽트 1회 처리.
     * @return 전이 후 단계
     */
    public InterruptStage signal() {
        int next = stage.updateAndGet(s -> Math.min(s + 1, InterruptStage.IMMEDIATE_EXIT.level()));
        InterruptStage st = InterruptStage.of(next);

        LOG.warn(st.message());
        if (st.nextHint() != null) LOG.warn(st.nextHint());
        SLOG.warn("interrupt", "stage", st.level());

        for (Consumer<InterruptStage> l : listeners) {
            try {
                l.accept(st);
            } catch (RuntimeException e) {
                LOG.debug("Interrupt listener failed: {}", e.toString());
            }
        }
        if (st == InterruptStage.IMMEDIATE_EXIT) {
            exitHook.run();
        }
        return st;
    }

    @Override
    public InterruptStage stage() {
        return InterruptStage.of(stage.get());
    }

    public int level() { return stage.get(); }

    /** 실행기에 넘길 읽기 전용 뷰 */
    public CancellationToken token() {
        return this::stage;
    }

    public void addListener(Consumer<InterruptStage> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /** 새 실행을 위해 0단계로 되돌림 */
    public void reset() {
        stage.set(0);
    }
}
