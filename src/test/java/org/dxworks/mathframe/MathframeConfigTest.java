package org.dxworks.mathframe;

import org.dxworks.mathframe.model.VerticalDirection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MathframeConfigTest {

    @TempDir
    Path tempDir;

    private Path writeConfig(String yaml) throws IOException {
        Path file = tempDir.resolve(MathframeConfig.CONFIG_FILE_NAME);
        Files.writeString(file, yaml);
        return file;
    }

    @Test
    void missingFileGivesDefaults() {
        MathframeConfig config = MathframeConfig.load(tempDir.resolve("absent.yml"));

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(50, config.getMaxHistory());
        assertEquals(VerticalDirection.UP, config.getVerticalEntry());
        assertFalse(config.isWrapUnknownCommands());
    }

    @Test
    void readsAllKeys() throws IOException {
        Path file = writeConfig("maxFileLines: 10\nmaxHistory: 5\nverticalEntry: down\nwrapUnknownCommands: true\n");

        MathframeConfig config = MathframeConfig.load(file);

        assertEquals(10, config.getMaxFileLines());
        assertEquals(5, config.getMaxHistory());
        assertEquals(VerticalDirection.DOWN, config.getVerticalEntry());
        assertTrue(config.isWrapUnknownCommands());
    }

    @Test
    void missingAndInvalidValuesFallBack() throws IOException {
        Path file = writeConfig("maxHistory: -3\nverticalEntry: sideways\n");

        MathframeConfig config = MathframeConfig.load(file);

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(50, config.getMaxHistory());
        assertEquals(VerticalDirection.UP, config.getVerticalEntry());
    }

    @Test
    void unreadableFileGivesDefaults() throws IOException {
        Path file = writeConfig("maxHistory: [not, a, number]\n");

        MathframeConfig config = MathframeConfig.load(file);

        assertEquals(50, config.getMaxHistory());
    }

    @Test
    void emptyFileGivesDefaults() throws IOException {
        MathframeConfig config = MathframeConfig.load(writeConfig(""));

        assertEquals(MathframeConfig.defaults().toString(), config.toString());
    }

    @Test
    void programmaticConfigReplacesNonPositiveValues() {
        MathframeConfig config = MathframeConfig.with(0, -1, null, true);

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(50, config.getMaxHistory());
        assertEquals(VerticalDirection.UP, config.getVerticalEntry());
        assertTrue(config.isWrapUnknownCommands());
    }
}
