package dev.recipeflow;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MainTest {

    @AfterEach
    void clearLogLevel() {
        System.clearProperty(Main.LOG_LEVEL_PROPERTY);
    }

    @Test
    void verboseRaisesLogLevelBeforeAnyCommandRuns() {
        Main.configureLogging(new String[] {"debug-table", "--verbose", "recipe.txt"});

        assertThat(System.getProperty(Main.LOG_LEVEL_PROPERTY)).isEqualTo("debug");
    }

    @Test
    void logLevelIsLeftAloneWithoutVerbose() {
        Main.configureLogging(new String[] {"debug-table", "recipe.txt"});

        assertThat(System.getProperty(Main.LOG_LEVEL_PROPERTY)).isNull();
    }
}
