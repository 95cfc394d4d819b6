package org.dxworks.mathframe.catalog;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class CommandCatalogTest {

    private static InputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void defaultCatalogIsLoadedOnce() {
        CommandCatalog catalog = CommandCatalog.getDefault();

        assertSame(catalog, CommandCatalog.getDefault());
        assertTrue(catalog.size() > 100);
    }

    @Test
    void symbolsCarryGlyphClassAndDegradation() {
        CommandDefinition leq = CommandCatalog.getDefault().lookup("leq").orElseThrow();

        assertEquals(CommandKind.SYMBOL, leq.getKind());
        assertEquals("≤", leq.getGlyph());
        assertEquals(SymbolClass.RELATION, leq.getSymbolClass());
        assertEquals("<", leq.getDegradesTo());
        assertEquals("\\leq", leq.getLatexCommand());

        CommandDefinition alpha = CommandCatalog.getDefault().lookup("alpha").orElseThrow();
        assertEquals(SymbolClass.ORDINARY, alpha.getSymbolClass());
        assertNull(alpha.getDegradesTo());
    }

    @Test
    void structuralCommandsHaveArities() {
        CommandCatalog catalog = CommandCatalog.getDefault();

        CommandDefinition frac = catalog.lookup("frac").orElseThrow();
        assertEquals(CommandKind.FRACTION, frac.getKind());
        assertEquals(2, frac.getRequiredArgs());

        CommandDefinition sqrt = catalog.lookup("sqrt").orElseThrow();
        assertEquals(1, sqrt.getRequiredArgs());
        assertEquals(1, sqrt.getOptionalArgs());

        assertEquals(CommandKind.LARGE_OPERATOR, catalog.lookup("sum").orElseThrow().getKind());
        assertEquals(CommandKind.LIMIT, catalog.lookup("lim").orElseThrow().getKind());
        assertEquals(CommandKind.OPERATOR_NAME, catalog.lookup("sin").orElseThrow().getKind());
        assertEquals("sin", catalog.lookup("sin").orElseThrow().getGlyph());
        assertTrue(catalog.lookup("sum").orElseThrow().getKind().takesLimits());
        assertFalse(frac.getKind().takesLimits());
    }

    @Test
    void accentsAndTextStyles() {
        CommandCatalog catalog = CommandCatalog.getDefault();

        assertEquals("⃗", catalog.lookup("vec").orElseThrow().getMark());
        CommandDefinition text = catalog.lookup("text").orElseThrow();
        assertTrue(text.isRawText());
        assertFalse(text.isAutoExit());
        CommandDefinition mathbb = catalog.lookup("mathbb").orElseThrow();
        assertTrue(mathbb.isAutoExit());
        assertFalse(mathbb.isRawText());
    }

    @Test
    void unknownCommandsAreAbsent() {
        assertTrue(CommandCatalog.getDefault().lookup("notacommand").isEmpty());
        assertFalse(CommandCatalog.getDefault().isKnown("notacommand"));
        assertTrue(CommandCatalog.getDefault().isKnown("alpha"));
    }

    @Test
    void loadsCustomTable() throws IOException {
        CommandCatalog catalog = CommandCatalog.fromStream(yaml(
                "version: 1\n"
                        + "symbols:\n"
                        + "  - { name: heart, glyph: \"♥\" }\n"
                        + "  - { name: approx, glyph: \"≈\", kind: relation }\n"
                        + "fractions:\n"
                        + "  - { name: frac }\n"));

        assertEquals(3, catalog.size());
        assertEquals(SymbolClass.RELATION, catalog.lookup("approx").orElseThrow().getSymbolClass());
        assertEquals(3, catalog.all().size());
    }

    @Test
    void rejectsUnsupportedVersion() {
        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> CommandCatalog.fromStream(yaml("version: 2\nsymbols: []\n")));
        assertTrue(error.getMessage().contains("version"));
    }

    @Test
    void rejectsDuplicateNames() {
        assertThrows(IllegalStateException.class, () -> CommandCatalog.fromStream(yaml(
                "version: 1\n"
                        + "symbols:\n"
                        + "  - { name: pi, glyph: \"π\" }\n"
                        + "operatorNames:\n"
                        + "  - { name: pi }\n")));
    }

    @Test
    void missingResourceFails() {
        assertThrows(IllegalStateException.class, () -> CommandCatalog.fromResource("no-such-catalog.yml"));
    }
}
