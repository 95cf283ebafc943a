package com.mathclip.render;

import com.mathclip.parser.Node;
import com.mathclip.parser.Row;

/**
 * Target-specific syntax for environments. {@link EnvironmentHandler}s decide the order
 * and the row forms; writers decide how each piece looks.
 */
public interface EnvironmentWriter {
    void openEnvironment(Node.Environment environment, RuleLayout rules);

    /** One row of an alignment; its cells are written without column markers. */
    void statement(Row row);

    /** One piecewise branch in prose form. */
    void branch(Row row);

    void gridRow(Row row);

    /** Written between two statements of an alignment. */
    void statementSeparator();

    /** Written between two rows of a grid or piecewise block. */
    void rowSeparator();

    void closeEnvironment(Node.Environment environment);
}
