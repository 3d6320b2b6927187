package com.auditsift.core.config;

/**
 * 설정 오류(잘못된 YAML, 정규식, 필터 값 등). 루트 설정 파일에서 나면 스캔 시작 전에 실행 전체를 중단시키고,
 * include 된 파일에서 나면 그 파일만 경고 후 건너뛴다.
 */
public class ConfigException extends Exception {

    private final String source;

    public ConfigException(String message) {
        this(message, null, null);
    }

    public ConfigException(String message, String source, Throwable cause) {
        super(source == null ? message : message + " [" + source + "]", cause);
        this.source = source;
    }

    /** 문제가 된 설정 파일 (알 수 없으면 null) */
    public String getSource() { return source; }
}
