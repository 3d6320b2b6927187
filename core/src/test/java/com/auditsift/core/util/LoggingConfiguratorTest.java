package com.auditsift.core.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.*;

class LoggingConfiguratorTest {

    @TempDir
    Path tmp;

    @AfterEach
    void restore() throws Exception {
        LogManager.getLogManager().readConfiguration();
    }

    @Test
    void init_installs_rolling_file_handler() throws Exception {
        Path logs = tmp.resolve("logs");

        String pattern = LoggingConfigurator.init(logs, Level.INFO, 1024 * 1024, 2);
        Logger.getLogger("com.auditsift.test").info("hello file");

        assertThat(pattern).endsWith("auditsift-%g.log");
        assertThat(Files.isDirectory(logs)).isTrue();
        assertThat(Files.exists(logs.resolve("auditsift-0.log"))).isTrue();
    }

    @Test
    void shortName_keeps_class_and_events_suffix() {
        assertThat(LoggingConfigurator.shortName("com.auditsift.core.search.SearchEngine")).isEqualTo("SearchEngine");
        assertThat(LoggingConfigurator.shortName("com.auditsift.core.search.SearchEngine.events"))
                .isEqualTo("SearchEngine.events");
        assertThat(LoggingConfigurator.shortName("Plain")).isEqualTo("Plain");
        assertThat(LoggingConfigurator.shortName(null)).isEqualTo("-");
    }
}
