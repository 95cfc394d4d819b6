package org.dxworks.mathframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.mathframe.model.VerticalDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

public class MathframeConfig {

    private static final Logger log = LoggerFactory.getLogger(MathframeConfig.class);

    public static final String CONFIG_FILE_NAME = "mathframe-config.yml";
    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final int DEFAULT_MAX_HISTORY = 50;
    private static final VerticalDirection DEFAULT_VERTICAL_ENTRY = VerticalDirection.UP;
    private static final boolean DEFAULT_WRAP_UNKNOWN_COMMANDS = false;

    private final int maxFileLines;
    private final int maxHistory;
    private final VerticalDirection verticalEntry;
    private final boolean wrapUnknownCommands;

    private MathframeConfig(int maxFileLines, int maxHistory, VerticalDirection verticalEntry,
                            boolean wrapUnknownCommands) {
        this.maxFileLines = maxFileLines;
        this.maxHistory = maxHistory;
        this.verticalEntry = verticalEntry;
        this.wrapUnknownCommands = wrapUnknownCommands;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public int getMaxHistory() {
        return maxHistory;
    }

    public VerticalDirection getVerticalEntry() {
        return verticalEntry;
    }

    public boolean isWrapUnknownCommands() {
        return wrapUnknownCommands;
    }

    public static MathframeConfig defaults() {
        return new MathframeConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_MAX_HISTORY, DEFAULT_VERTICAL_ENTRY,
                DEFAULT_WRAP_UNKNOWN_COMMANDS);
    }

    public static MathframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    /**
     * Reads the YAML file at {@code configPath}. Missing keys, a missing file and an unreadable
     * file all fall back to the defaults.
     */
    public static MathframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                int effectiveMaxHistory = (yamlConfig.maxHistory != null && yamlConfig.maxHistory > 0)
                        ? yamlConfig.maxHistory
                        : DEFAULT_MAX_HISTORY;
                VerticalDirection effectiveVerticalEntry = parseVerticalEntry(yamlConfig.verticalEntry);
                boolean effectiveWrapUnknownCommands = (yamlConfig.wrapUnknownCommands != null)
                        ? yamlConfig.wrapUnknownCommands
                        : DEFAULT_WRAP_UNKNOWN_COMMANDS;

                return new MathframeConfig(effectiveMaxFileLines, effectiveMaxHistory, effectiveVerticalEntry,
                        effectiveWrapUnknownCommands);
            }
        } catch (IOException e) {
            log.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static MathframeConfig with(int maxFileLines, int maxHistory, VerticalDirection verticalEntry,
                                       boolean wrapUnknownCommands) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        int effectiveMaxHistory = maxHistory > 0 ? maxHistory : DEFAULT_MAX_HISTORY;
        VerticalDirection effectiveVerticalEntry = verticalEntry != null ? verticalEntry : DEFAULT_VERTICAL_ENTRY;
        return new MathframeConfig(effectiveMaxFileLines, effectiveMaxHistory, effectiveVerticalEntry,
                wrapUnknownCommands);
    }

    private static VerticalDirection parseVerticalEntry(String value) {
        if (value == null) {
            return DEFAULT_VERTICAL_ENTRY;
        }
        try {
            return VerticalDirection.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown verticalEntry '{}', using {}", value, DEFAULT_VERTICAL_ENTRY);
            return DEFAULT_VERTICAL_ENTRY;
        }
    }

    @Override
    public String toString() {
        return "MathframeConfig{maxFileLines=" + maxFileLines + ", maxHistory=" + maxHistory
                + ", verticalEntry=" + verticalEntry + ", wrapUnknownCommands=" + wrapUnknownCommands + "}";
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Integer maxHistory;
        public String verticalEntry;
        public Boolean wrapUnknownCommands;
    }
}
