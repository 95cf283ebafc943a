package com.mathclip.normalize;

import com.mathclip.parser.Cell;
import com.mathclip.parser.Diagnostic;
import com.mathclip.parser.Diagnostics;
import com.mathclip.parser.Node;
import com.mathclip.parser.Row;
import com.mathclip.parser.RowForm;
import com.mathclip.table.CommandKind;
import com.mathclip.table.EnvironmentKind;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Locale;

/**
 * Tags the rows of piecewise environments so renderers can write them as prose:
 * "value if condition" or "value otherwise".
 * <p>
 * Only the shape of a row is inspected. A condition counts as the fallback when it is
 * an "otherwise" marker, or when it is empty on the last row.
 */
public class PiecewiseRewriter {
    private static final ImmutableSet<String> OTHERWISE_MARKERS = Sets.immutable.of("otherwise", "else");
    private static final String SEPARATOR_PUNCTUATION = ",;";

    public Node.Group rewrite(Node.Group root, Diagnostics diagnostics) {
        return new Node.Group(rewriteAll(root.children(), diagnostics));
    }

    private ImmutableList<Node> rewriteAll(ImmutableList<Node> nodes, Diagnostics diagnostics) {
        return nodes.collect(node -> rewriteNode(node, diagnostics));
    }

    private Node rewriteNode(Node node, Diagnostics diagnostics) {
        if (node instanceof Node.Group group) {
            return new Node.Group(rewriteAll(group.children(), diagnostics));
        }
        if (node instanceof Node.Command command) {
            ImmutableList<Node.Group> arguments = command.arguments()
                .collect(argument -> new Node.Group(rewriteAll(argument.children(), diagnostics)));
            Node.Group optional = command.optional() == null
                ? null
                : new Node.Group(rewriteAll(command.optional().children(), diagnostics));
            return command.withArguments(arguments, optional);
        }
        if (node instanceof Node.Environment environment) {
            ImmutableList<Row> rows = environment.rows().collect(row -> row.withCells(
                row.cells().collect(cell -> new Cell(rewriteAll(cell.nodes(), diagnostics)))));
            if (environment.kind() == EnvironmentKind.PIECEWISE) {
                rows = tagBranches(environment.name(), rows, diagnostics);
            }
            return environment.withRows(rows);
        }
        return node;
    }

    private ImmutableList<Row> tagBranches(String name, ImmutableList<Row> rows, Diagnostics diagnostics) {
        MutableList<Row> tagged = Lists.mutable.empty();
        for (int i = 0; i < rows.size(); i++) {
            Row row = rows.get(i);
            if (row.cells().size() != 2) {
                diagnostics.report(Diagnostic.Kind.DEGENERATE_ENVIRONMENT_ROW,
                    name + " row " + (i + 1) + " has " + row.cells().size() + " cells", -1);
                tagged.add(row.withForm(RowForm.DEGENERATE));
                continue;
            }

            Cell value = stripTrailingPunctuation(row.cell(0));
            Cell condition = stripLeadingPunctuation(row.cell(1));
            boolean last = i == rows.size() - 1;

            RowForm form;
            if (isOtherwiseMarker(condition)) {
                form = RowForm.FALLBACK;
                condition = new Cell(Lists.immutable.empty());
            } else if (condition.isBlank()) {
                form = last ? RowForm.FALLBACK : RowForm.VALUE_ONLY;
                condition = new Cell(Lists.immutable.empty());
            } else {
                form = RowForm.CONDITION;
            }
            tagged.add(row.withCells(Lists.immutable.of(value, condition)).withForm(form));
        }
        return tagged.toImmutable();
    }

    private static Cell stripTrailingPunctuation(Cell cell) {
        MutableList<Node> nodes = Lists.mutable.ofAll(cell.nodes());
        if (!nodes.isEmpty() && nodes.getLast() instanceof Node.TextRun run) {
            String text = run.text().stripTrailing();
            while (!text.isEmpty() && SEPARATOR_PUNCTUATION.indexOf(text.charAt(text.length() - 1)) >= 0) {
                text = text.substring(0, text.length() - 1).stripTrailing();
            }
            replaceOrRemove(nodes, nodes.size() - 1, text);
        }
        return new Cell(nodes.toImmutable());
    }

    private static Cell stripLeadingPunctuation(Cell cell) {
        MutableList<Node> nodes = Lists.mutable.ofAll(cell.nodes());
        if (!nodes.isEmpty() && nodes.getFirst() instanceof Node.TextRun run) {
            String text = run.text().stripLeading();
            while (!text.isEmpty() && SEPARATOR_PUNCTUATION.indexOf(text.charAt(0)) >= 0) {
                text = text.substring(1).stripLeading();
            }
            replaceOrRemove(nodes, 0, text);
        }
        return new Cell(nodes.toImmutable());
    }

    private static void replaceOrRemove(MutableList<Node> nodes, int index, String text) {
        if (text.isEmpty()) {
            nodes.remove(index);
        } else {
            nodes.set(index, new Node.TextRun(text));
        }
    }

    private static boolean isOtherwiseMarker(Cell condition) {
        StringBuilder words = new StringBuilder();
        for (Node node : condition.nodes()) {
            if (!appendWords(node, words)) {
                return false;
            }
        }
        String marker = words.toString().trim().toLowerCase(Locale.ROOT);
        while (!marker.isEmpty() && ".,;".indexOf(marker.charAt(marker.length() - 1)) >= 0) {
            marker = marker.substring(0, marker.length() - 1).trim();
        }
        return OTHERWISE_MARKERS.contains(marker);
    }

    /**
     * Appends the literal words of plain text and text-command nodes; returns false for anything else.
     */
    private static boolean appendWords(Node node, StringBuilder words) {
        if (node instanceof Node.TextRun run) {
            words.append(run.text());
            return true;
        }
        if (node instanceof Node.Group group) {
            return group.children().allSatisfy(child -> appendWords(child, words));
        }
        if (node instanceof Node.Command command) {
            CommandKind kind = command.spec().kind();
            if (kind == CommandKind.SPACING) {
                words.append(' ');
                return true;
            }
            if (kind == CommandKind.TEXT || kind == CommandKind.STYLE) {
                return command.arguments().allSatisfy(argument -> appendWords(argument, words));
            }
        }
        return false;
    }
}
