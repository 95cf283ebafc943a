package com.mathclip.parser;

/**
 * How a row is rendered. The parser produces {@link #CELLS}; the piecewise rewrite
 * assigns the other forms.
 */
public enum RowForm {
    CELLS,
    /** "value if condition" */
    CONDITION,
    /** "value otherwise" */
    FALLBACK,
    /** A piecewise row whose condition is empty but is not the last row; renders its value alone. */
    VALUE_ONLY,
    /** A piecewise row with the wrong number of cells; renders as a grid row. */
    DEGENERATE
}
