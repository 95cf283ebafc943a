package com.mathclip.parser;

import com.mathclip.lexer.Token;
import com.mathclip.table.ArgumentStyle;
import com.mathclip.table.CommandKind;
import com.mathclip.table.CommandSpec;
import com.mathclip.table.CommandTable;
import com.mathclip.table.EnvironmentSpec;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;

/**
 * Recursive-descent parser from tokens to a tree of {@link Node}s.
 * <p>
 * Row and column separators split an environment only at the environment's own depth.
 * A separator inside a nested group, or outside any environment, is kept as literal text.
 */
public class MathParser {
    private final CommandTable table;

    public MathParser(CommandTable table) {
        this.table = table;
    }

    public Node.Group parse(List<Token> tokens, Diagnostics diagnostics) throws UnbalancedDelimiterException {
        return new Cursor(tokens, diagnostics).parseRoot();
    }

    private enum Context {
        ROOT,
        GROUP,
        CELL,
        /** Inside {@code [...]}; ends at the closing bracket. */
        OPTIONAL
    }

    private final class Cursor {
        // Copied because single-character arguments split text tokens in place
        private final MutableList<Token> tokens;
        private final Diagnostics diagnostics;
        private int p = 0;

        Cursor(List<Token> tokens, Diagnostics diagnostics) {
            this.tokens = Lists.mutable.ofAll(tokens);
            this.diagnostics = diagnostics;
        }

        Node.Group parseRoot() throws UnbalancedDelimiterException {
            return new Node.Group(parseSequence(Context.ROOT, null).toImmutable());
        }

        private MutableList<Node> parseSequence(Context context, Token opener) throws UnbalancedDelimiterException {
            MutableList<Node> nodes = Lists.mutable.empty();

            while (true) {
                Token t = at(p);

                if (t == null) {
                    if (context == Context.GROUP) {
                        throw new UnbalancedDelimiterException("{", opener.position(), "group is never closed");
                    }
                    return nodes;
                }

                if (t instanceof Token.GroupClose) {
                    if (context != Context.GROUP) {
                        throw new UnbalancedDelimiterException("}", t.position(), "no group is open");
                    }
                    p++;
                    return nodes;
                }

                if (t instanceof Token.EnvEnd end) {
                    if (context == Context.CELL) {
                        return nodes;
                    }
                    if (context == Context.GROUP) {
                        throw new UnbalancedDelimiterException("{", opener.position(),
                            "group is not closed before \\end{" + end.name() + "}");
                    }
                    throw new UnbalancedDelimiterException("\\end{" + end.name() + "}", end.position(),
                        "no environment is open");
                }

                if (t instanceof Token.RowSep || t instanceof Token.ColSep) {
                    if (context == Context.CELL) {
                        return nodes;
                    }
                    String lexeme = t instanceof Token.RowSep ? "\\\\" : "&";
                    diagnostics.report(Diagnostic.Kind.STRAY_SEPARATOR, lexeme, t.position());
                    nodes.add(new Node.TextRun(lexeme));
                    p++;
                    continue;
                }

                p++;
                if (t instanceof Token.Text text) {
                    if (context == Context.OPTIONAL && text.value().equals("]")) {
                        return nodes;
                    }
                    nodes.add(new Node.TextRun(text.value()));
                } else if (t instanceof Token.GroupOpen) {
                    nodes.add(new Node.Group(parseSequence(Context.GROUP, t).toImmutable()));
                } else if (t instanceof Token.EnvBegin begin) {
                    nodes.add(parseEnvironment(begin));
                } else if (t instanceof Token.CommandName command) {
                    nodes.add(parseCommand(command, context));
                } else if (t instanceof Token.Spacing spacing) {
                    nodes.add(Node.Command.of(CommandSpec.spacing(spacing.kind().controlName())));
                }
            }
        }

        private Node.Command parseCommand(Token.CommandName token, Context context) throws UnbalancedDelimiterException {
            CommandSpec spec = table.command(token.name());
            if (spec == null) {
                diagnostics.report(Diagnostic.Kind.UNKNOWN_COMMAND_ARITY, token.name(), token.position());
                spec = CommandSpec.unknown(token.name());
            }

            Node.Group optional = null;
            if (spec.optionalArgument()) {
                int q = skipBlankText(p);
                if (at(q) instanceof Token.Text text && text.value().equals("[") && findOptionalClose(q + 1) != -1) {
                    p = q + 1;
                    optional = new Node.Group(parseSequence(Context.OPTIONAL, text).toImmutable());
                }
            }

            MutableList<Node.Group> arguments = Lists.mutable.empty();
            if (spec.argumentStyle() == ArgumentStyle.TOKEN) {
                Node.Group argument = parseTokenArgument(context);
                if (argument != null) {
                    arguments.add(argument);
                }
            } else {
                for (int i = 0; i < spec.arity(); i++) {
                    int q = skipBlankText(p);
                    if (!(at(q) instanceof Token.GroupOpen open)) {
                        break;
                    }
                    p = q + 1;
                    arguments.add(new Node.Group(parseSequence(Context.GROUP, open).toImmutable()));
                }
            }

            return new Node.Command(token.name(), spec, arguments.toImmutable(), optional);
        }

        /**
         * Reads the argument of a script or sized delimiter: a brace group, the next
         * character of a text run, or one command. Inside an optional argument the closing
         * {@code ]} is never taken.
         */
        private Node.Group parseTokenArgument(Context context) throws UnbalancedDelimiterException {
            int q = skipBlankText(p);
            Token next = at(q);

            if (context == Context.OPTIONAL && next instanceof Token.Text close && close.value().equals("]")) {
                return null;
            }

            if (next instanceof Token.GroupOpen) {
                p = q + 1;
                return new Node.Group(parseSequence(Context.GROUP, next).toImmutable());
            }
            if (next instanceof Token.Text text) {
                String value = text.value().stripLeading();
                int skipped = text.value().length() - value.length();
                String first = new String(Character.toChars(value.codePointAt(0)));
                String rest = value.substring(first.length());
                if (rest.isEmpty()) {
                    p = q + 1;
                } else {
                    tokens.set(q, new Token.Text(rest, text.position() + skipped + first.length()));
                    p = q;
                }
                return Node.Group.of(new Node.TextRun(first));
            }
            if (next instanceof Token.CommandName command) {
                p = q + 1;
                return Node.Group.of(parseCommand(command, context));
            }
            return null;
        }

        private Node.Environment parseEnvironment(Token.EnvBegin begin) throws UnbalancedDelimiterException {
            String name = begin.name();
            EnvironmentSpec spec = table.environment(name);
            if (spec == null) {
                diagnostics.report(Diagnostic.Kind.UNKNOWN_ENVIRONMENT, name, begin.position());
                spec = EnvironmentSpec.fallback(name);
            }

            String columnSpec = null;
            if (spec.columnSpec()) {
                int q = skipBlankText(p);
                if (at(q) instanceof Token.GroupOpen open) {
                    p = q + 1;
                    columnSpec = plainText(parseSequence(Context.GROUP, open));
                }
            }

            MutableList<Row> rows = Lists.mutable.empty();
            while (true) {
                boolean ruleAbove = consumeRules();
                MutableList<Cell> cells = Lists.mutable.empty();

                while (true) {
                    MutableList<Node> nodes = parseSequence(Context.CELL, begin);
                    Token t = at(p);
                    if (t == null) {
                        throw new UnbalancedDelimiterException("\\begin{" + name + "}", begin.position(),
                            "environment is never closed");
                    }
                    p++;
                    cells.add(new Cell(nodes.toImmutable()));

                    if (t instanceof Token.ColSep) {
                        continue;
                    }
                    rows.add(new Row(cells.toImmutable(), ruleAbove));
                    if (t instanceof Token.EnvEnd end) {
                        if (!end.name().equals(name)) {
                            throw new UnbalancedDelimiterException("\\end{" + end.name() + "}", end.position(),
                                "expected \\end{" + name + "}");
                        }
                        return new Node.Environment(name, spec, columnSpec, dropTrailingBlankRows(rows).toImmutable());
                    }
                    break;
                }
            }
        }

        /**
         * Consumes {@code \hline} markers at the start of a row.
         */
        private boolean consumeRules() {
            boolean rule = false;
            while (true) {
                int q = skipBlankText(p);
                if (at(q) instanceof Token.CommandName command && isRule(command.name())) {
                    p = q + 1;
                    rule = true;
                } else {
                    return rule;
                }
            }
        }

        private boolean isRule(String name) {
            CommandSpec spec = table.command(name);
            return spec != null && spec.kind() == CommandKind.RULE;
        }

        /**
         * A closing {@code \\} leaves an empty last row; its rule, if any, belongs below the row before.
         */
        private MutableList<Row> dropTrailingBlankRows(MutableList<Row> rows) {
            while (rows.size() > 1 && rows.getLast().isBlank()) {
                Row dropped = rows.remove(rows.size() - 1);
                if (dropped.ruleAbove()) {
                    rows.set(rows.size() - 1, rows.getLast().withRuleBelow());
                }
            }
            if (rows.size() == 1 && rows.getFirst().isBlank()) {
                rows.clear();
            }
            return rows;
        }

        /**
         * Index of the {@code ]} closing an optional argument that starts at {@code start}, or -1.
         */
        private int findOptionalClose(int start) {
            int depth = 0;
            for (int i = start; i < tokens.size(); i++) {
                Token t = tokens.get(i);
                if (t instanceof Token.GroupOpen) {
                    depth++;
                } else if (t instanceof Token.GroupClose) {
                    if (depth == 0) {
                        return -1;
                    }
                    depth--;
                } else if (depth == 0) {
                    if (t instanceof Token.Text text && text.value().equals("]")) {
                        return i;
                    }
                    if (t instanceof Token.RowSep || t instanceof Token.ColSep
                        || t instanceof Token.EnvBegin || t instanceof Token.EnvEnd) {
                        return -1;
                    }
                }
            }
            return -1;
        }

        private int skipBlankText(int i) {
            while (at(i) instanceof Token.Text text && text.value().isBlank()) {
                i++;
            }
            return i;
        }

        private Token at(int i) {
            return i < tokens.size() ? tokens.get(i) : null;
        }
    }

    private static String plainText(MutableList<Node> nodes) {
        StringBuilder sb = new StringBuilder();
        for (Node node : nodes) {
            if (node instanceof Node.TextRun run) {
                sb.append(run.text());
            } else if (node instanceof Node.Group group) {
                sb.append(plainText(Lists.mutable.ofAll(group.children())));
            }
        }
        return sb.toString();
    }
}
