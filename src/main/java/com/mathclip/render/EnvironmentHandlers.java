package com.mathclip.render;

import com.mathclip.parser.Node;
import com.mathclip.parser.Row;
import com.mathclip.parser.RowForm;
import com.mathclip.table.EnvironmentKind;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.EnumMap;
import java.util.Map;

/**
 * The dispatch table from environment kind to handler, shared by every renderer.
 */
public final class EnvironmentHandlers {
    private static final Map<EnvironmentKind, EnvironmentHandler> HANDLERS = new EnumMap<>(EnvironmentKind.class);

    static {
        HANDLERS.put(EnvironmentKind.ALIGNMENT, EnvironmentHandlers::alignment);
        HANDLERS.put(EnvironmentKind.PIECEWISE, EnvironmentHandlers::piecewise);
        HANDLERS.put(EnvironmentKind.GRID, (environment, writer) -> grid(environment, writer, RuleLayout.NONE));
        HANDLERS.put(EnvironmentKind.GRID_WITH_RULES,
            (environment, writer) -> grid(environment, writer, RuleLayout.of(environment.rows())));
    }

    private EnvironmentHandlers() {
    }

    public static EnvironmentHandler forKind(EnvironmentKind kind) {
        return HANDLERS.get(kind);
    }

    /** Each row is one statement; column markers are ignored. */
    private static void alignment(Node.Environment environment, EnvironmentWriter writer) {
        writer.openEnvironment(environment, RuleLayout.NONE);
        ImmutableList<Row> rows = environment.rows();
        for (int i = 0; i < rows.size(); i++) {
            if (i > 0) {
                writer.statementSeparator();
            }
            writer.statement(rows.get(i));
        }
        writer.closeEnvironment(environment);
    }

    /** Tagged rows become prose branches; untagged and degenerate rows stay grid rows. */
    private static void piecewise(Node.Environment environment, EnvironmentWriter writer) {
        writer.openEnvironment(environment, RuleLayout.NONE);
        ImmutableList<Row> rows = environment.rows();
        for (int i = 0; i < rows.size(); i++) {
            if (i > 0) {
                writer.rowSeparator();
            }
            Row row = rows.get(i);
            if (row.form() == RowForm.CELLS || row.form() == RowForm.DEGENERATE) {
                writer.gridRow(row);
            } else {
                writer.branch(row);
            }
        }
        writer.closeEnvironment(environment);
    }

    private static void grid(Node.Environment environment, EnvironmentWriter writer, RuleLayout rules) {
        writer.openEnvironment(environment, rules);
        ImmutableList<Row> rows = environment.rows();
        for (int i = 0; i < rows.size(); i++) {
            if (i > 0) {
                writer.rowSeparator();
            }
            writer.gridRow(rows.get(i));
        }
        writer.closeEnvironment(environment);
    }
}
