package org.dxworks.mathframe.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of the backslash commands the engine understands, read from {@code commands.yml}.
 * Immutable once loaded and safe to share between documents.
 */
public class CommandCatalog {

    private static final Logger log = LoggerFactory.getLogger(CommandCatalog.class);

    public static final String DEFAULT_RESOURCE = "commands.yml";
    private static final int SUPPORTED_VERSION = 1;

    private static volatile CommandCatalog defaultCatalog;

    private final Map<String, CommandDefinition> commands;

    private CommandCatalog(Map<String, CommandDefinition> commands) {
        this.commands = Collections.unmodifiableMap(commands);
    }

    /**
     * Catalog bundled with the engine, loaded on first use.
     */
    public static CommandCatalog getDefault() {
        CommandCatalog catalog = defaultCatalog;
        if (catalog == null) {
            synchronized (CommandCatalog.class) {
                catalog = defaultCatalog;
                if (catalog == null) {
                    catalog = fromResource(DEFAULT_RESOURCE);
                    defaultCatalog = catalog;
                }
            }
        }
        return catalog;
    }

    public static CommandCatalog fromResource(String resource) {
        try (InputStream in = CommandCatalog.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Command catalog resource not found: " + resource);
            }
            return fromStream(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read command catalog " + resource, e);
        }
    }

    public static CommandCatalog fromStream(InputStream in) throws IOException {
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        YamlCatalog yaml = yamlMapper.readValue(in, YamlCatalog.class);
        if (yaml == null) {
            throw new IllegalStateException("Command catalog is empty");
        }
        if (yaml.version == null || yaml.version != SUPPORTED_VERSION) {
            throw new IllegalStateException("Unsupported command catalog version: " + yaml.version);
        }

        Map<String, CommandDefinition> commands = new LinkedHashMap<>();
        for (YamlEntry entry : nonNull(yaml.symbols)) {
            put(commands, new CommandDefinition(entry.name, CommandKind.SYMBOL, entry.glyph,
                    SymbolClass.fromYaml(entry.kind), entry.degradesTo, null, false, false));
        }
        for (YamlEntry entry : nonNull(yaml.operatorNames)) {
            put(commands, new CommandDefinition(entry.name, CommandKind.OPERATOR_NAME,
                    entry.glyph != null ? entry.glyph : entry.name, null, null, null, false, false));
        }
        for (YamlEntry entry : nonNull(yaml.largeOperators)) {
            put(commands, new CommandDefinition(entry.name, CommandKind.LARGE_OPERATOR, entry.glyph,
                    null, null, null, false, false));
        }
        for (YamlEntry entry : nonNull(yaml.limits)) {
            put(commands, new CommandDefinition(entry.name, CommandKind.LIMIT,
                    entry.glyph != null ? entry.glyph : entry.name, null, null, null, false, false));
        }
        for (YamlEntry entry : nonNull(yaml.fractions)) {
            put(commands, simple(entry, CommandKind.FRACTION));
        }
        for (YamlEntry entry : nonNull(yaml.roots)) {
            put(commands, simple(entry, CommandKind.SQUARE_ROOT));
        }
        for (YamlEntry entry : nonNull(yaml.binomials)) {
            put(commands, simple(entry, CommandKind.BINOMIAL));
        }
        for (YamlEntry entry : nonNull(yaml.accents)) {
            put(commands, new CommandDefinition(entry.name, CommandKind.ACCENT, null, null, null,
                    entry.mark, false, false));
        }
        for (YamlEntry entry : nonNull(yaml.textStyles)) {
            put(commands, new CommandDefinition(entry.name, CommandKind.TEXT_STYLE, null, null, null, null,
                    Boolean.TRUE.equals(entry.autoExit), Boolean.TRUE.equals(entry.rawText)));
        }

        log.debug("Loaded command catalog version {} with {} commands", yaml.version, commands.size());
        return new CommandCatalog(commands);
    }

    private static CommandDefinition simple(YamlEntry entry, CommandKind kind) {
        return new CommandDefinition(entry.name, kind, null, null, null, null, false, false);
    }

    private static void put(Map<String, CommandDefinition> commands, CommandDefinition definition) {
        if (definition.getName() == null || definition.getName().isEmpty()) {
            throw new IllegalStateException("Command catalog entry without a name in " + definition.getKind());
        }
        CommandDefinition previous = commands.put(definition.getName(), definition);
        if (previous != null) {
            throw new IllegalStateException("Duplicate command in catalog: \\" + definition.getName());
        }
    }

    private static List<YamlEntry> nonNull(List<YamlEntry> entries) {
        return entries != null ? entries : Collections.emptyList();
    }

    /**
     * Looks up a command by name, without the leading backslash.
     */
    public Optional<CommandDefinition> lookup(String name) {
        return Optional.ofNullable(commands.get(name));
    }

    public boolean isKnown(String name) {
        return commands.containsKey(name);
    }

    public Collection<CommandDefinition> all() {
        return commands.values();
    }

    public int size() {
        return commands.size();
    }

    private static class YamlCatalog {
        public Integer version;
        public List<YamlEntry> symbols;
        public List<YamlEntry> operatorNames;
        public List<YamlEntry> largeOperators;
        public List<YamlEntry> limits;
        public List<YamlEntry> fractions;
        public List<YamlEntry> roots;
        public List<YamlEntry> binomials;
        public List<YamlEntry> accents;
        public List<YamlEntry> textStyles;
    }

    private static class YamlEntry {
        public String name;
        public String glyph;
        public String kind;
        public String degradesTo;
        public String mark;
        public Boolean autoExit;
        public Boolean rawText;
    }
}
