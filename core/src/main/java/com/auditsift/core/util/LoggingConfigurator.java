package com.auditsift.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * 호스트 프로그램용 로깅 초기화. SLF4J 는 slf4j-jdk14 바인딩으로 java.util.logging 에 붙는다.
 * 콘솔 + 순환 파일(auditsift-%g.log) 핸들러를 설치한다.
 */
public final class LoggingConfigurator {
    private LoggingConfigurator() {}

    /** @return 설치된 파일 로그 경로 패턴, 파일 핸들러 실패 시 null */
    public static String init(Path logDir, Level rootLevel, int maxBytes, int fileCount) {
        Logger root = LogManager.getLogManager().getLogger("");
        for (Handler h : root.getHandlers()) root.removeHandler(h);

        Formatter fmt = new Formatter() {
            @Override public String format(LogRecord r) {
                String msg = formatMessage(r);
                return String.format("%1$tF %1$tT %2$-7s %3$s - %4$s%n",
                        r.getMillis(), r.getLevel().getName(), shortName(r.getLoggerName()), msg);
            }
        };

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(rootLevel);
        console.setFormatter(fmt);
        root.addHandler(console);
        root.setLevel(rootLevel);

        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve("auditsift-%g.log").toString();
            FileHandler file = new FileHandler(pattern, Math.max(1, maxBytes), Math.max(1, fileCount), true);
            file.setLevel(rootLevel);
            file.setFormatter(fmt);
            root.addHandler(file);
            return pattern;
        } catch (IOException e) {
            root.log(Level.WARNING, "Failed to init file handler: " + e.getMessage());
            return null;
        }
    }

    static String shortName(String loggerName) {
        if (loggerName == null) return "-";
        int i = loggerName.lastIndexOf('.', loggerName.endsWith(".events") ? loggerName.length() - 8 : loggerName.length());
        return (i < 0) ? loggerName : loggerName.substring(i + 1);
    }
}
