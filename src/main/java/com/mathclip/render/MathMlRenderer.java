package com.mathclip.render;

import com.mathclip.lexer.SpacingKind;
import com.mathclip.parser.Cell;
import com.mathclip.parser.Node;
import com.mathclip.parser.Row;
import com.mathclip.parser.RowForm;
import com.mathclip.table.CommandKind;
import com.mathclip.table.EnvironmentKind;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Renders presentation MathML as accepted by office equation editors.
 */
public class MathMlRenderer implements TreeRenderer {
    public static final String NAMESPACE = "http://www.w3.org/1998/Math/MathML";

    private static final String NBSP = "&#160;";

    @Override
    public String render(Node.Group tree) {
        Walker walker = new Walker();
        walker.emitAll(tree.children());
        return "<math xmlns=\"" + NAMESPACE + "\" display=\"block\">"
            + walker.currentRow().makeString("")
            + "</math>";
    }

    private static final class Walker extends TreeWalker {
        // Each level holds the finished fragments of one row; scripts wrap the last one
        private final Deque<MutableList<String>> rows = new ArrayDeque<>();
        private final Deque<Table> tables = new ArrayDeque<>();
        private String variant = null;
        private boolean textMode = false;

        Walker() {
            rows.push(Lists.mutable.empty());
        }

        MutableList<String> currentRow() {
            return rows.peek();
        }

        private void add(String fragment) {
            currentRow().add(fragment);
        }

        @Override
        protected void emitText(Node.TextRun text) {
            if (textMode || (variant != null && text.text().chars().anyMatch(Character::isWhitespace))) {
                add(element("mtext", variant, escapeText(text.text(), true)));
                return;
            }

            String s = text.text();
            int i = 0;
            while (i < s.length()) {
                int cp = s.codePointAt(i);
                int next = i + Character.charCount(cp);

                if (Character.isWhitespace(cp)) {
                    i = next;
                } else if (Character.isDigit(cp)) {
                    int end = next;
                    while (end < s.length() && (Character.isDigit(s.charAt(end))
                        || (s.charAt(end) == '.' && end + 1 < s.length() && Character.isDigit(s.charAt(end + 1))))) {
                        end++;
                    }
                    add(element("mn", variant, s.substring(i, end)));
                    i = end;
                } else if (Character.isLetter(cp)) {
                    int end = next;
                    // Inside a style command a word stays one identifier
                    while (variant != null && end < s.length() && Character.isLetter(s.charAt(end))) {
                        end++;
                    }
                    add(element("mi", variant, s.substring(i, end)));
                    i = end;
                } else {
                    add(element("mo", null, escapeText(s.substring(i, next), false)));
                    i = next;
                }
            }
        }

        @Override
        protected void emitGroup(Node.Group group) {
            add(row(group.children()));
        }

        @Override
        protected void emitCommand(Node.Command command) {
            CommandKind kind = command.spec().kind();
            switch (kind) {
                case TEXT, STYLE -> {
                    String savedVariant = variant;
                    boolean savedTextMode = textMode;
                    if (command.spec().variant() != null) {
                        variant = command.spec().variant();
                    }
                    textMode = kind == CommandKind.TEXT;
                    emitAll(command.arguments());
                    variant = savedVariant;
                    textMode = savedTextMode;
                }
                case FRACTION -> add("<mfrac>" + row(command.argument(0)) + row(command.argument(1)) + "</mfrac>");
                case ROOT -> {
                    if (command.optional() == null) {
                        add("<msqrt>" + row(command.argument(0)) + "</msqrt>");
                    } else {
                        add("<mroot>" + row(command.argument(0)) + row(command.optional()) + "</mroot>");
                    }
                }
                case BINOMIAL -> add("<mrow><mo>(</mo><mfrac linethickness=\"0\">" + row(command.argument(0))
                    + row(command.argument(1)) + "</mfrac><mo>)</mo></mrow>");
                case FUNCTION -> add("<mi>" + escapeText(command.spec().plainOrName(), false) + "</mi>");
                case SYMBOL -> {
                    String tag = command.spec().element();
                    add("<" + tag + ">" + escapeText(command.spec().markupOrPlain(), false) + "</" + tag + ">");
                }
                case SUPERSCRIPT, SUBSCRIPT -> {
                    String tag = kind == CommandKind.SUPERSCRIPT ? "msup" : "msub";
                    MutableList<String> current = currentRow();
                    String base = current.isEmpty() ? "<mrow></mrow>" : current.remove(current.size() - 1);
                    current.add("<" + tag + ">" + base + row(command.argument(0)) + "</" + tag + ">");
                }
                case DELIMITER -> {
                    Node.Group delimiter = command.argument(0);
                    if (delimiter.children().size() == 1 && delimiter.children().getFirst() instanceof Node.TextRun run) {
                        if (!run.text().equals(".")) {
                            add("<mo stretchy=\"true\">" + escapeText(run.text(), false) + "</mo>");
                        }
                    } else {
                        emitAll(delimiter.children());
                    }
                }
                case SPACING -> {
                    SpacingKind spacing = SpacingKind.forName(command.name());
                    if (spacing == null || spacing == SpacingKind.EXPLICIT || textMode) {
                        add("<mtext>" + NBSP + "</mtext>");
                    } else {
                        add("<mspace width=\"" + spacing.width() + "\"/>");
                    }
                }
                case UNKNOWN -> add("<mtext>\\" + escapeText(command.name(), false) + "</mtext>");
                case RULE, IGNORED -> { }
            }
        }

        @Override
        public void openEnvironment(Node.Environment environment, RuleLayout rules) {
            tables.push(new Table(environment, rules));
        }

        @Override
        public void statement(Row row) {
            MutableList<Node> nodes = Lists.mutable.empty();
            for (Cell cell : row.cells()) {
                nodes.addAllIterable(cell.nodes());
            }
            tables.peek().rows.append("<mtr><mtd>").append(row(nodes)).append("</mtd></mtr>");
        }

        @Override
        public void branch(Row row) {
            StringBuilder sb = tables.peek().rows;
            sb.append("<mtr><mtd>").append(row(row.cell(0).nodes())).append("</mtd>");
            if (row.form() == RowForm.CONDITION) {
                sb.append("<mtd><mtext>if").append(NBSP).append("</mtext>")
                  .append(row(row.cell(1).nodes())).append("</mtd>");
            } else if (row.form() == RowForm.FALLBACK) {
                sb.append("<mtd><mtext>otherwise</mtext></mtd>");
            }
            sb.append("</mtr>");
        }

        @Override
        public void gridRow(Row row) {
            StringBuilder sb = tables.peek().rows;
            sb.append("<mtr>");
            for (Cell cell : row.cells()) {
                sb.append("<mtd>").append(row(cell.nodes())).append("</mtd>");
            }
            sb.append("</mtr>");
        }

        @Override
        public void statementSeparator() {
            // Statements are separate table rows
        }

        @Override
        public void rowSeparator() {
            // Rows are separate table rows
        }

        @Override
        public void closeEnvironment(Node.Environment environment) {
            Table table = tables.pop();
            String mtable = "<mtable" + table.attributes() + ">" + table.rows + "</mtable>";

            String notation = table.outerRules();
            if (!notation.isEmpty()) {
                mtable = "<menclose notation=\"" + notation + "\">" + mtable + "</menclose>";
            }

            String open = environment.spec().markupOpen();
            String close = environment.spec().markupClose();
            if (open.isEmpty() && close.isEmpty()) {
                add(mtable);
            } else {
                add("<mrow>" + fence(open) + mtable + fence(close) + "</mrow>");
            }
        }

        private String row(Node.Group group) {
            return row(group.children());
        }

        /**
         * Renders nodes as one element, wrapping several fragments in an {@code mrow}.
         */
        private String row(Iterable<? extends Node> nodes) {
            rows.push(Lists.mutable.empty());
            emitAll(nodes);
            MutableList<String> fragments = rows.pop();
            return fragments.size() == 1 ? fragments.getFirst() : "<mrow>" + fragments.makeString("") + "</mrow>";
        }

        private static String fence(String delimiter) {
            return delimiter.isEmpty() ? "" : "<mo stretchy=\"true\">" + escapeText(delimiter, false) + "</mo>";
        }

        private static String element(String tag, String variant, String content) {
            String attribute = variant != null ? " mathvariant=\"" + variant + "\"" : "";
            return "<" + tag + attribute + ">" + content + "</" + tag + ">";
        }
    }

    private static final class Table {
        final Node.Environment environment;
        final RuleLayout rules;
        final StringBuilder rows = new StringBuilder();

        Table(Node.Environment environment, RuleLayout rules) {
            this.environment = environment;
            this.rules = rules;
        }

        String attributes() {
            StringBuilder sb = new StringBuilder();
            EnvironmentKind kind = environment.kind();
            if (kind == EnvironmentKind.ALIGNMENT) {
                sb.append(" columnalign=\"left\"");
            } else if (kind == EnvironmentKind.PIECEWISE) {
                sb.append(" columnalign=\"left left\"");
            } else if (environment.columnSpec() != null) {
                ColumnSpec columns = ColumnSpec.parse(environment.columnSpec());
                if (!columns.alignments().isEmpty()) {
                    sb.append(" columnalign=\"").append(columns.alignments().makeString(" ")).append('"');
                }
                if (columns.hasInnerLines()) {
                    sb.append(" columnlines=\"").append(columns.lines().makeString(" ")).append('"');
                }
            }

            int rowCount = environment.rows().size();
            if (rules.any() && rowCount > 1) {
                MutableList<String> lines = Lists.mutable.empty();
                for (int i = 1; i < rowCount; i++) {
                    lines.add(rules.hasRuleAt(i) ? "solid" : "none");
                }
                if (lines.contains("solid")) {
                    sb.append(" rowlines=\"").append(lines.makeString(" ")).append('"');
                }
            }
            return sb.toString();
        }

        /** {@code menclose} notation for rules above the first and below the last row. */
        String outerRules() {
            int rowCount = environment.rows().size();
            boolean top = rules.hasRuleAt(0);
            boolean bottom = rowCount > 0 && rules.hasRuleAt(rowCount);
            if (top && bottom) {
                return "top bottom";
            }
            return top ? "top" : bottom ? "bottom" : "";
        }
    }

    static String escapeText(String s, boolean nonBreakingSpaces) {
        boolean needsEscaping = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '&' || c == '<' || c == '>' || c == '"' || (nonBreakingSpaces && c == ' ') || c < 0x20) {
                needsEscaping = true;
                break;
            }
        }

        if (!needsEscaping) {
            return s;
        }

        StringBuilder result = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&' -> result.append("&amp;");
                case '<' -> result.append("&lt;");
                case '>' -> result.append("&gt;");
                case '"' -> result.append("&quot;");
                case ' ' -> result.append(nonBreakingSpaces ? NBSP : " ");
                case '\t', '\n', '\r' -> result.append(c);
                default -> {
                    // Other C0 controls are not allowed in XML
                    if (c >= 0x20) {
                        result.append(c);
                    }
                }
            }
        }
        return result.toString();
    }
}
