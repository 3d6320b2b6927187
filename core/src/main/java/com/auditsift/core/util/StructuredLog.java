package com.auditsift.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * JSON 라인 기반 구조화 로거.
 * 일반 로그와 같은 SLF4J 로거로 나가므로 LoggingConfigurator 의 핸들러 설정을 그대로 따른다.
 * 호출 형식: {@code SLOG.info("event", "key1", v1, "key2", v2)}
 */
public final class StructuredLog {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Logger log;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.log = LoggerFactory.getLogger(cls.getName() + ".events");
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) {
        if (log.isDebugEnabled()) log.debug(line("DEBUG", event, null, kvs));
    }

    public void info(String event, Object... kvs) {
        if (log.isInfoEnabled()) log.info(line("INFO", event, null, kvs));
    }

    public void warn(String event, Object... kvs) {
        if (log.isWarnEnabled()) log.warn(line("WARN", event, null, kvs));
    }

    public void error(String event, Throwable t, Object... kvs) {
        if (!log.isErrorEnabled()) return;
        String line = line("ERROR", event, t, kvs);
        if (t == null) log.error(line); else log.error(line, t);
    }

    String line(String lvl, String event, Throwable t, Object... kvs) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("ts", Instant.now().toString());
        node.put("lvl", lvl);
        node.put("comp", comp);
        node.put("thread", Thread.currentThread().getName());
        node.put("event", event);

        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                put(node, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) node.put("_kv_mismatch", true);
        }
        if (t != null) {
            node.put("error", t.getClass().getSimpleName());
            node.put("message", t.getMessage());
        }
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return "{\"event\":\"" + event + "\",\"_serialization_error\":true}";
        }
    }

    private static void put(ObjectNode node, String k, Object v) {
        if (v == null) node.putNull(k);
        else if (v instanceof Integer i) node.put(k, i);
        else if (v instanceof Long l) node.put(k, l);
        else if (v instanceof Double d) node.put(k, d);
        else if (v instanceof Boolean b) node.put(k, b);
        else node.put(k, String.valueOf(v));
    }
}
