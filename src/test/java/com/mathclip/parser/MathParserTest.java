package com.mathclip.parser;

import com.mathclip.lexer.MathLexer;
import com.mathclip.table.CommandKind;
import com.mathclip.table.CommandTable;
import com.mathclip.table.EnvironmentKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class MathParserTest {

    private final MathLexer lexer = new MathLexer();
    private final MathParser parser = new MathParser(CommandTable.builtIn());

    private Node.Group parse(String markup, Diagnostics diagnostics) throws UnbalancedDelimiterException {
        return parser.parse(lexer.tokenize(markup), diagnostics);
    }

    private Node.Group parse(String markup) throws UnbalancedDelimiterException {
        return parse(markup, new Diagnostics());
    }

    // ========== COMMANDS ==========

    @Test
    public void testFractionCollectsTwoArguments() throws Exception {
        Node.Group root = parse("\\frac{a}{b}");

        assertEquals(1, root.children().size());
        assertTrue(root.children().get(0) instanceof Node.Command);
        Node.Command frac = (Node.Command) root.children().get(0);
        assertEquals(CommandKind.FRACTION, frac.spec().kind());
        assertEquals(2, frac.arguments().size());
        assertEquals(Node.Group.of(new Node.TextRun("a")), frac.argument(0));
        assertEquals(Node.Group.of(new Node.TextRun("b")), frac.argument(1));
    }

    @Test
    public void testArgumentsMaySpanWhitespace() throws Exception {
        Node.Group root = parse("\\frac {a} {b}");

        Node.Command frac = (Node.Command) root.children().get(0);
        assertEquals(2, frac.arguments().size());
    }

    @Test
    public void testMissingArgumentIsEmptyGroup() throws Exception {
        Node.Group root = parse("\\frac{a}");

        Node.Command frac = (Node.Command) root.children().get(0);
        assertEquals(1, frac.arguments().size());
        assertTrue(frac.argument(1).isEmpty());
    }

    @Test
    public void testSquareRootWithIndex() throws Exception {
        Node.Group root = parse("\\sqrt[3]{x}");

        Node.Command sqrt = (Node.Command) root.children().get(0);
        assertNotNull(sqrt.optional());
        assertEquals(Node.Group.of(new Node.TextRun("3")), sqrt.optional());
        assertEquals(Node.Group.of(new Node.TextRun("x")), sqrt.argument(0));
    }

    @Test
    public void testUnclosedBracketIsText() throws Exception {
        Node.Group root = parse("\\sqrt[x");

        Node.Command sqrt = (Node.Command) root.children().get(0);
        assertNull(sqrt.optional());
        assertTrue(sqrt.arguments().isEmpty());
        assertEquals(new Node.TextRun("["), root.children().get(1));
    }

    @Test
    public void testScriptTakesSingleCharacter() throws Exception {
        Node.Group root = parse("x^23");

        assertEquals(3, root.children().size());
        assertEquals(new Node.TextRun("x"), root.children().get(0));
        Node.Command sup = (Node.Command) root.children().get(1);
        assertEquals(CommandKind.SUPERSCRIPT, sup.spec().kind());
        assertEquals(Node.Group.of(new Node.TextRun("2")), sup.argument(0));
        assertEquals(new Node.TextRun("3"), root.children().get(2));
    }

    @Test
    public void testScriptTakesWholeCommand() throws Exception {
        Node.Group root = parse("e^\\pi");

        Node.Command sup = (Node.Command) root.children().get(1);
        Node.Group argument = sup.argument(0);
        assertEquals(1, argument.children().size());
        assertTrue(argument.children().get(0) instanceof Node.Command);
        assertEquals("pi", ((Node.Command) argument.children().get(0)).name());
    }

    @Test
    public void testScriptInsideOptionalArgumentLeavesClosingBracket() throws Exception {
        Node.Group root = parse("{\\sqrt[x^]{y}}");

        Node.Group group = (Node.Group) root.children().get(0);
        Node.Command sqrt = (Node.Command) group.children().get(0);
        assertNotNull(sqrt.optional());
        assertEquals(2, sqrt.optional().children().size());
        Node.Command sup = (Node.Command) sqrt.optional().children().get(1);
        assertTrue(sup.arguments().isEmpty());
        assertEquals(Node.Group.of(new Node.TextRun("y")), sqrt.argument(0));
    }

    @Test
    public void testScriptInsideOptionalArgumentInCell() throws Exception {
        Node.Group root = parse("\\begin{matrix} \\sqrt[x_] & 1 \\end{matrix}");

        Node.Environment env = (Node.Environment) root.children().get(0);
        assertEquals(1, env.rows().size());
        assertEquals(2, env.rows().get(0).cells().size());
    }

    @Test
    public void testUnknownCommandTakesNoArguments() throws Exception {
        Diagnostics diagnostics = new Diagnostics();
        Node.Group root = parse("\\foo{x}", diagnostics);

        assertEquals(2, root.children().size());
        Node.Command foo = (Node.Command) root.children().get(0);
        assertEquals(CommandKind.UNKNOWN, foo.spec().kind());
        assertTrue(foo.arguments().isEmpty());
        assertTrue(root.children().get(1) instanceof Node.Group);
        assertTrue(diagnostics.contains(Diagnostic.Kind.UNKNOWN_COMMAND_ARITY));
        assertEquals(new Diagnostic(Diagnostic.Kind.UNKNOWN_COMMAND_ARITY, "foo", 0), diagnostics.toList().get(0));
    }

    // ========== ENVIRONMENTS ==========

    @Test
    public void testMatrixRowsAndCells() throws Exception {
        Node.Group root = parse("\\begin{bmatrix} a & b \\\\ c & d \\end{bmatrix}");

        assertTrue(root.children().get(0) instanceof Node.Environment);
        Node.Environment env = (Node.Environment) root.children().get(0);
        assertEquals("bmatrix", env.name());
        assertEquals(EnvironmentKind.GRID, env.kind());
        assertEquals(2, env.rows().size());
        assertEquals(2, env.rows().get(0).cells().size());
        assertEquals(2, env.rows().get(1).cells().size());
    }

    @Test
    public void testSeparatorsInsideGroupBelongToGroup() throws Exception {
        Diagnostics diagnostics = new Diagnostics();
        Node.Group root = parse("\\begin{matrix} {a & b} & c \\end{matrix}", diagnostics);

        Node.Environment env = (Node.Environment) root.children().get(0);
        assertEquals(1, env.rows().size());
        assertEquals(2, env.rows().get(0).cells().size());
        assertTrue(diagnostics.contains(Diagnostic.Kind.STRAY_SEPARATOR));
    }

    @Test
    public void testNestedEnvironmentKeepsOwnRows() throws Exception {
        Node.Group root = parse(
            "\\begin{bmatrix} \\begin{matrix} a \\\\ b \\end{matrix} & c \\\\ d & e \\end{bmatrix}");

        Node.Environment outer = (Node.Environment) root.children().get(0);
        assertEquals(2, outer.rows().size());
        Node.Environment inner = (Node.Environment) outer.rows().get(0).cell(0).nodes()
            .detect(node -> node instanceof Node.Environment);
        assertNotNull(inner);
        assertEquals(2, inner.rows().size());
    }

    @Test
    public void testSeparatorOutsideEnvironmentIsText() throws Exception {
        Diagnostics diagnostics = new Diagnostics();
        Node.Group root = parse("a & b", diagnostics);

        assertEquals(3, root.children().size());
        assertEquals(new Node.TextRun("&"), root.children().get(1));
        assertEquals(new Diagnostic(Diagnostic.Kind.STRAY_SEPARATOR, "&", 2), diagnostics.toList().get(0));
    }

    @Test
    public void testUnknownEnvironmentFallsBackToGrid() throws Exception {
        Diagnostics diagnostics = new Diagnostics();
        Node.Group root = parse("\\begin{foo} a & b \\\\ c & d \\end{foo}", diagnostics);

        Node.Environment env = (Node.Environment) root.children().get(0);
        assertEquals(EnvironmentKind.GRID, env.kind());
        assertEquals(2, env.rows().size());
        assertTrue(diagnostics.contains(Diagnostic.Kind.UNKNOWN_ENVIRONMENT));
    }

    @Test
    public void testArrayColumnSpecAndRules() throws Exception {
        Node.Group root = parse("\\begin{array}{c|c} \\hline a & b \\\\ c & d \\\\ \\hline \\end{array}");

        Node.Environment env = (Node.Environment) root.children().get(0);
        assertEquals("c|c", env.columnSpec());
        assertEquals(2, env.rows().size());
        assertTrue(env.rows().get(0).ruleAbove());
        assertFalse(env.rows().get(0).ruleBelow());
        assertFalse(env.rows().get(1).ruleAbove());
        assertTrue(env.rows().get(1).ruleBelow());
    }

    @Test
    public void testTrailingRowBreakAddsNoRow() throws Exception {
        Node.Group root = parse("\\begin{align} a &= b \\\\ \\end{align}");

        Node.Environment env = (Node.Environment) root.children().get(0);
        assertEquals(1, env.rows().size());
    }

    @Test
    public void testEmptyEnvironmentHasNoRows() throws Exception {
        Node.Group root = parse("\\begin{matrix}\\end{matrix}");

        Node.Environment env = (Node.Environment) root.children().get(0);
        assertTrue(env.rows().isEmpty());
    }

    // ========== BALANCE ERRORS ==========

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "{a                                        | {               | 0",
        "a}                                       | }               | 1",
        "\\frac{a}{b                              | {               | 8",
        "\\begin{matrix} a                         | \\begin{matrix} | 0",
        "\\begin{matrix} a \\end{pmatrix}          | \\end{pmatrix}  | 17",
        "\\end{matrix}                             | \\end{matrix}   | 0",
        "\\begin{matrix} {a \\end{matrix}          | {               | 15"
    })
    public void testUnbalancedDelimiters(String markup, String marker, int position) {
        UnbalancedDelimiterException e = assertThrows(UnbalancedDelimiterException.class, () -> parse(markup));

        assertEquals(marker, e.marker());
        assertEquals(position, e.position());
        assertTrue(e.getMessage().startsWith("Unbalanced delimiter " + marker));
    }
}
