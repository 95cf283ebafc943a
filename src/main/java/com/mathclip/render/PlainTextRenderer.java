package com.mathclip.render;

import com.mathclip.lexer.SpacingKind;
import com.mathclip.parser.Cell;
import com.mathclip.parser.Node;
import com.mathclip.parser.Row;
import com.mathclip.parser.RowForm;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.regex.Pattern;

/**
 * Renders a simplified plain-text form: {@code \frac{a}{b}} becomes {@code (a)/(b)},
 * matrices become {@code [a, b; c, d]}, piecewise blocks become prose.
 */
public class PlainTextRenderer implements TreeRenderer {
    public static final String DEFAULT_STATEMENT_SEPARATOR = "\n";

    private static final Pattern BARE_SCRIPT = Pattern.compile("[\\p{L}\\p{N}]+|.");

    private final String statementSeparator;

    public PlainTextRenderer() {
        this(DEFAULT_STATEMENT_SEPARATOR);
    }

    public PlainTextRenderer(String statementSeparator) {
        this.statementSeparator = statementSeparator;
    }

    @Override
    public String render(Node.Group tree) {
        Walker walker = new Walker(statementSeparator);
        walker.emit(tree);
        return walker.buffer.toString();
    }

    private static final class Walker extends TreeWalker {
        private final String statementSeparator;
        private PlainTextBuffer buffer = new PlainTextBuffer();
        private int preserving = 0;

        Walker(String statementSeparator) {
            this.statementSeparator = statementSeparator;
        }

        @Override
        protected void emitText(Node.TextRun text) {
            if (preserving > 0) {
                buffer.verbatim(text.text());
            } else {
                buffer.text(text.text());
            }
        }

        @Override
        protected void emitGroup(Node.Group group) {
            emitAll(group.children());
        }

        @Override
        protected void emitCommand(Node.Command command) {
            switch (command.spec().kind()) {
                case TEXT, STYLE -> {
                    preserving++;
                    emitAll(command.arguments());
                    preserving--;
                }
                case FRACTION -> buffer.verbatim("(" + fragment(command.argument(0)) + ")/("
                    + fragment(command.argument(1)) + ")");
                case ROOT -> {
                    if (command.optional() == null) {
                        buffer.verbatim("sqrt(" + fragment(command.argument(0)) + ")");
                    } else {
                        buffer.verbatim("(" + fragment(command.argument(0)) + ")^(1/"
                            + fragment(command.optional()) + ")");
                    }
                }
                case BINOMIAL -> buffer.verbatim("C(" + fragment(command.argument(0)) + ", "
                    + fragment(command.argument(1)) + ")");
                case FUNCTION, SYMBOL -> buffer.word(command.spec().plainOrName());
                case SUPERSCRIPT, SUBSCRIPT -> {
                    String script = fragment(command.argument(0));
                    buffer.verbatim(command.name());
                    if (BARE_SCRIPT.matcher(script).matches()) {
                        buffer.verbatim(script);
                    } else if (!script.isEmpty()) {
                        buffer.verbatim("(" + script + ")");
                    }
                }
                case DELIMITER -> {
                    String delimiter = fragment(command.argument(0));
                    if (!delimiter.equals(".")) {
                        buffer.verbatim(delimiter);
                    }
                }
                case SPACING -> {
                    if (SpacingKind.forName(command.name()) != SpacingKind.NEGATIVE_THIN) {
                        if (preserving > 0) {
                            buffer.verbatim(" ");
                        } else {
                            buffer.space();
                        }
                    }
                }
                case UNKNOWN -> buffer.text("\\" + command.name());
                case RULE, IGNORED -> { }
            }
        }

        @Override
        public void openEnvironment(Node.Environment environment, RuleLayout rules) {
            if (!environment.spec().plainOpen().isEmpty()) {
                buffer.space();
            }
            buffer.text(environment.spec().plainOpen());
        }

        @Override
        public void closeEnvironment(Node.Environment environment) {
            buffer.text(environment.spec().plainClose());
        }

        @Override
        public void statement(Row row) {
            buffer.verbatim(join(row, " "));
        }

        @Override
        public void branch(Row row) {
            String value = fragment(row.cell(0).nodes());
            if (row.form() == RowForm.CONDITION) {
                buffer.verbatim(value + " if " + fragment(row.cell(1).nodes()));
            } else if (row.form() == RowForm.FALLBACK) {
                buffer.verbatim(value.isEmpty() ? "otherwise" : value + " otherwise");
            } else {
                buffer.verbatim(value);
            }
        }

        @Override
        public void gridRow(Row row) {
            buffer.verbatim(join(row, ", "));
        }

        @Override
        public void statementSeparator() {
            buffer.separator(statementSeparator);
        }

        @Override
        public void rowSeparator() {
            buffer.separator("; ");
        }

        private String join(Row row, String separator) {
            MutableList<String> cells = Lists.mutable.empty();
            for (Cell cell : row.cells()) {
                String rendered = fragment(cell.nodes());
                if (!rendered.isEmpty() || !separator.isBlank()) {
                    cells.add(rendered);
                }
            }
            return cells.makeString(separator);
        }

        private String fragment(Node node) {
            return fragment(Lists.immutable.of(node));
        }

        /**
         * Renders nodes into a fresh buffer, so the result carries no edge whitespace.
         */
        private String fragment(Iterable<? extends Node> nodes) {
            PlainTextBuffer saved = buffer;
            buffer = new PlainTextBuffer();
            emitAll(nodes);
            String result = buffer.toString();
            buffer = saved;
            return result;
        }
    }
}
