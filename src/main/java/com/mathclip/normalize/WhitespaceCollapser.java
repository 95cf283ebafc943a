package com.mathclip.normalize;

import com.mathclip.parser.Cell;
import com.mathclip.parser.Node;
import com.mathclip.parser.Row;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.regex.Pattern;

/**
 * Merges adjacent text runs and collapses each whitespace run to a single space,
 * except inside the arguments of preserve-spacing commands. The whole tree and every
 * environment cell are trimmed. Applying the pass twice gives the same tree as once.
 */
public class WhitespaceCollapser {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public Node.Group collapse(Node.Group root) {
        return new Node.Group(trim(collapseSequence(root.children(), false)));
    }

    private MutableList<Node> collapseSequence(ImmutableList<Node> nodes, boolean preserve) {
        MutableList<Node> out = Lists.mutable.empty();
        StringBuilder pending = new StringBuilder();

        for (Node node : nodes) {
            if (node instanceof Node.TextRun run) {
                pending.append(run.text());
                continue;
            }
            flush(out, pending, preserve);
            out.add(collapseNode(node, preserve));
        }
        flush(out, pending, preserve);
        return out;
    }

    private Node collapseNode(Node node, boolean preserve) {
        if (node instanceof Node.Group group) {
            return new Node.Group(collapseSequence(group.children(), preserve).toImmutable());
        }
        if (node instanceof Node.Command command) {
            boolean inner = preserve || command.preservesSpacing();
            ImmutableList<Node.Group> arguments = command.arguments()
                .collect(argument -> new Node.Group(collapseSequence(argument.children(), inner).toImmutable()));
            Node.Group optional = command.optional() == null
                ? null
                : new Node.Group(collapseSequence(command.optional().children(), inner).toImmutable());
            return command.withArguments(arguments, optional);
        }
        if (node instanceof Node.Environment environment) {
            ImmutableList<Row> rows = environment.rows().collect(row -> row.withCells(row.cells()
                .collect(cell -> {
                    MutableList<Node> nodes = collapseSequence(cell.nodes(), preserve);
                    return new Cell(preserve ? nodes.toImmutable() : trim(nodes));
                })));
            return environment.withRows(rows);
        }
        return node;
    }

    private void flush(MutableList<Node> out, StringBuilder pending, boolean preserve) {
        if (pending.length() == 0) {
            return;
        }
        String text = preserve ? pending.toString() : WHITESPACE.matcher(pending).replaceAll(" ");
        out.add(new Node.TextRun(text));
        pending.setLength(0);
    }

    private static ImmutableList<Node> trim(MutableList<Node> nodes) {
        if (!nodes.isEmpty() && nodes.getFirst() instanceof Node.TextRun first) {
            String text = first.text().stripLeading();
            if (text.isEmpty()) {
                nodes.remove(0);
            } else {
                nodes.set(0, new Node.TextRun(text));
            }
        }
        if (!nodes.isEmpty() && nodes.getLast() instanceof Node.TextRun last) {
            String text = last.text().stripTrailing();
            if (text.isEmpty()) {
                nodes.remove(nodes.size() - 1);
            } else {
                nodes.set(nodes.size() - 1, new Node.TextRun(text));
            }
        }
        return nodes.toImmutable();
    }
}
