package com.mathclip.render;

import com.mathclip.ConversionException;
import com.mathclip.MathConverter;
import com.mathclip.table.CommandTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class PlainTextRendererTest {

    private final MathConverter converter = new MathConverter();

    private String plain(String markup) throws ConversionException {
        return converter.convert(markup).plainText();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "\\frac{a}{b}                  | (a)/(b)",
        "\\frac{1+\\frac{1}{x}}{y}     | (1+(1)/(x))/(y)",
        "\\sqrt{\\frac{a}{b}}          | sqrt((a)/(b))",
        "\\sqrt[3]{x}                  | (x)^(1/3)",
        "\\binom{n}{k}                 | C(n, k)",
        "x^2                           | x^2",
        "e^{i\\pi}                     | e^(i pi)",
        "x_{i+1}                       | x_(i+1)",
        "x_{12}                        | x_12",
        "\\sin x + \\cos y             | sin x + cos y",
        "\\alpha \\cdot \\beta \\leq \\gamma | alpha · beta ≤ gamma",
        "a\\quad b                     | a b",
        "a\\!b                         | ab",
        "\\displaystyle \\sum x        | ∑ x",
        "\\alpha\\beta                 | alpha beta",
        "2\\pi r                       | 2 pi r",
        "\\foo                         | \\foo"
    })
    public void testInlineConstructs(String markup, String expected) throws Exception {
        assertEquals(expected, plain(markup));
    }

    @Test
    public void testTextKeepsInnerSpacing() throws Exception {
        assertEquals("a   b + c d", plain("\\text{a   b} + c   d"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "x = \\text{ if } y       | x = if y",
        "a \\quad \\text{ b}     | a b",
        "a + \\mathrm{ d}x        | a + dx",
        "\\text{a} \\text{ b}    | a b"
    })
    public void testNoDoubleSpaceBeforePreservedText(String markup, String expected) throws Exception {
        String result = plain(markup);

        assertEquals(expected, result);
        assertFalse(result.contains("  "));
    }

    @Test
    public void testMatrix() throws Exception {
        assertEquals("[a, b; c, d]", plain("\\begin{bmatrix} a & b \\\\ c & d \\end{bmatrix}"));
        assertEquals("(1, 0; 0, 1)", plain("\\begin{pmatrix} 1 & 0 \\\\ 0 & 1 \\end{pmatrix}"));
    }

    @Test
    public void testMatrixVectorProduct() throws Exception {
        String markup = "A\\mathbf{x} = \\begin{bmatrix} 1 & 2 \\\\ 3 & 4 \\end{bmatrix}"
            + "\\begin{bmatrix} x_1 \\\\ x_2 \\end{bmatrix} = \\begin{bmatrix} 5 \\\\ 11 \\end{bmatrix}";

        assertEquals("Ax = [1, 2; 3, 4] [x_1; x_2] = [5; 11]", plain(markup));
    }

    @Test
    public void testRulesAreDropped() throws Exception {
        String markup = "\\begin{array}{c|c} \\hline a & b \\\\ \\hline c & d \\\\ \\hline \\end{array}";

        assertEquals("[a, b; c, d]", plain(markup));
    }

    @Test
    public void testPiecewise() throws Exception {
        assertEquals("x^2 if x > 0; 0 otherwise",
            plain("\\begin{cases} x^2, & x > 0 \\\\ 0, & \\text{otherwise} \\end{cases}"));
        assertEquals("x^2 if x > 0; 0 otherwise",
            plain("\\begin{cases} x^2 & x > 0 \\\\ 0 & \\end{cases}"));
        assertEquals("a; b otherwise",
            plain("\\begin{cases} a & \\\\ b & \\text{otherwise} \\end{cases}"));
    }

    @Test
    public void testDegeneratePiecewiseRowKeepsItsCells() throws Exception {
        assertEquals("a; b if c", plain("\\begin{cases} a \\\\ b & c \\end{cases}"));
    }

    @Test
    public void testAlignmentStatements() throws Exception {
        assertEquals("a = b + c\nd = e - f",
            plain("\\begin{align*} a &= b + c \\\\ d &= e - f \\end{align*}"));
    }

    @Test
    public void testStatementSeparatorIsConfigurable() throws Exception {
        MathConverter custom = new MathConverter(CommandTable.builtIn(), " | ");

        assertEquals("a = b | c = d",
            custom.convert("\\begin{align*} a &= b \\\\ c &= d \\end{align*}").plainText());
    }

    @Test
    public void testEscapedAmpersandInText() throws Exception {
        String markup = "NOI = \\text{Gross Potential Income} - \\text{Vacancy \\& Collection Losses}"
            + " - \\text{Operating Expenses}";

        assertEquals("NOI = Gross Potential Income - Vacancy & Collection Losses - Operating Expenses",
            plain(markup));
    }

    @Test
    public void testEmptyInput() throws Exception {
        assertEquals("", plain(""));
        assertEquals("", plain("   "));
    }
}
