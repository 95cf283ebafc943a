package com.mathclip.table;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class CommandTableLoaderTest {

    private final CommandTableLoader loader = new CommandTableLoader();

    private static InputStream json(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    // ========== BUILT-IN TABLE ==========

    @Test
    public void testBuiltInTableLoads() {
        CommandTable table = CommandTable.builtIn();

        assertTrue(table.commandCount() > 100);
        assertTrue(table.environmentCount() > 20);
        assertSame(table, CommandTable.builtIn());
    }

    @Test
    public void testBuiltInEntries() {
        CommandTable table = CommandTable.builtIn();

        CommandSpec frac = table.command("frac");
        assertEquals(CommandKind.FRACTION, frac.kind());
        assertEquals(2, frac.arity());
        assertFalse(frac.preserveSpacing());

        CommandSpec text = table.command("text");
        assertEquals(CommandKind.TEXT, text.kind());
        assertTrue(text.preserveSpacing());

        CommandSpec sqrt = table.command("sqrt");
        assertTrue(sqrt.optionalArgument());

        CommandSpec sup = table.command("^");
        assertEquals(ArgumentStyle.TOKEN, sup.argumentStyle());

        assertEquals("α", table.command("alpha").markup());
        assertEquals("alpha", table.command("alpha").plain());
        assertNull(table.command("nosuchcommand"));
    }

    @Test
    public void testBuiltInEnvironments() {
        CommandTable table = CommandTable.builtIn();

        assertEquals(EnvironmentKind.PIECEWISE, table.environment("cases").kind());
        assertEquals(EnvironmentKind.ALIGNMENT, table.environment("align*").kind());
        assertEquals(EnvironmentKind.GRID, table.environment("pmatrix").kind());
        assertEquals("(", table.environment("pmatrix").plainOpen());
        assertEquals(EnvironmentKind.GRID_WITH_RULES, table.environment("array").kind());
        assertTrue(table.environment("array").columnSpec());
        assertNull(table.environment("nosuchenvironment"));
    }

    // ========== LOADING ==========

    @Test
    public void testDefaultsComeFromKind() throws IOException {
        CommandTable table = loader.load(json(
            "{\"commands\": [{\"name\": \"overline\", \"kind\": \"style\"}], \"environments\": []}"));

        CommandSpec spec = table.command("overline");
        assertEquals(CommandKind.STYLE, spec.kind());
        assertEquals(1, spec.arity());
        assertEquals(ArgumentStyle.BRACED, spec.argumentStyle());
        assertTrue(spec.preserveSpacing());
        assertFalse(spec.optionalArgument());
        assertEquals("mi", spec.element());
        assertNull(spec.variant());
    }

    @Test
    public void testExplicitFieldsOverrideDefaults() throws IOException {
        CommandTable table = loader.load(json("""
            {
              "commands": [
                {"name": "myfrac", "kind": "FRACTION", "arity": 3, "preserveSpacing": true, "variant": null}
              ],
              "environments": [
                {"name": "mycases", "kind": "PIECEWISE", "plainOpen": "<", "columnSpec": true}
              ]
            }
            """));

        CommandSpec spec = table.command("myfrac");
        assertEquals(3, spec.arity());
        assertTrue(spec.preserveSpacing());
        assertNull(spec.variant());

        EnvironmentSpec env = table.environment("mycases");
        assertEquals("<", env.plainOpen());
        assertEquals("", env.plainClose());
        assertTrue(env.columnSpec());
    }

    @Test
    public void testMergeOverridesBuiltIn() throws IOException {
        CommandTable overrides = loader.load(json(
            "{\"commands\": [{\"name\": \"frac\", \"kind\": \"BINOMIAL\"},"
                + " {\"name\": \"R\", \"kind\": \"SYMBOL\", \"plain\": \"real\", \"markup\": \"ℝ\"}]}"));

        CommandTable merged = CommandTable.builtIn().mergedWith(overrides);

        assertEquals(CommandKind.BINOMIAL, merged.command("frac").kind());
        assertEquals("real", merged.command("R").plain());
        assertEquals(CommandKind.TEXT, merged.command("text").kind());
        assertEquals(CommandTable.builtIn().commandCount() + 1, merged.commandCount());
        assertEquals(CommandKind.FRACTION, CommandTable.builtIn().command("frac").kind());
    }

    // ========== MALFORMED TABLES ==========

    @Test
    public void testUnknownKindFails() {
        CommandTableException e = assertThrows(CommandTableException.class, () -> loader.load(json(
            "{\"commands\": [{\"name\": \"x\", \"kind\": \"WIDGET\"}]}")));

        assertTrue(e.getMessage().contains("WIDGET"));
    }

    @Test
    public void testNonNumericArityFails() {
        CommandTableException e = assertThrows(CommandTableException.class, () -> loader.load(json(
            "{\"commands\": [{\"name\": \"x\", \"kind\": \"FRACTION\", \"arity\": \"two\"}]}")));

        assertEquals("Invalid arity 'two' for x", e.getMessage());
        assertTrue(e.getCause() instanceof NumberFormatException);
    }

    @Test
    public void testMissingNameFails() {
        assertThrows(CommandTableException.class, () -> loader.load(json(
            "{\"commands\": [{\"kind\": \"SYMBOL\"}]}")));
    }

    @Test
    public void testUnknownSectionFails() {
        assertThrows(CommandTableException.class, () -> loader.load(json("{\"macros\": []}")));
    }

    @Test
    public void testNestedValueFails() {
        assertThrows(CommandTableException.class, () -> loader.load(json(
            "{\"commands\": [{\"name\": \"x\", \"kind\": \"SYMBOL\", \"plain\": [1]}]}")));
    }

    @Test
    public void testTopLevelArrayFails() {
        assertThrows(CommandTableException.class, () -> loader.load(json("[]")));
    }
}
