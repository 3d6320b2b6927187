package com.auditsift.core.parallel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sun.misc.Signal;
import sun.misc.SignalHandler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * OS 신호(INT/TERM) → {@link InterruptController#signal()} 연결.
 * 인터럽트 단계를 올리는 곳은 여기뿐이다.
 */
public final class SignalInterruptSource implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SignalInterruptSource.class);
    private static final List<String> SIGNALS = List.of("INT", "TERM");

    private final InterruptController controller;
    private final Map<String, SignalHandler> previous = new LinkedHashMap<>();

    public SignalInterruptSource(InterruptController controller) {
        this.controller = Objects.requireNonNull(controller, "controller");
    }

    /** @return 실제로 등록된 신호 수 (플랫폼에서 지원하지 않는 신호는 건너뜀) */
    public synchronized int install() {
        if (!previous.isEmpty()) return previous.size();
        for (String name : SIGNALS) {
            try {
                SignalHandler old = Signal.handle(new Signal(name), sig -> controller.signal());
                previous.put(name, old);
            } catch (IllegalArgumentException e) {
                LOG.debug("Signal {} not available on this platform: {}", name, e.getMessage());
            }
        }
        LOG.debug("Interrupt handlers installed for {}", previous.keySet());
        return previous.size();
    }

    /** 이전 핸들러 복원 */
    public synchronized void uninstall() {
        for (Map.Entry<String, SignalHandler> e : previous.entrySet()) {
            try {
                Signal.handle(new Signal(e.getKey()), e.getValue());
            } catch (IllegalArgumentException ex) {
                LOG.debug("Cannot restore handler for {}: {}", e.getKey(), ex.getMessage());
            }
        }
        previous.clear();
    }

    public synchronized boolean isInstalled() { return !previous.isEmpty(); }

    @Override
    public void close() { uninstall(); }
}
