package com.mathclip.parser;

import org.eclipse.collections.api.list.ImmutableList;

public record Cell(ImmutableList<Node> nodes) {

    /** True when the cell holds nothing but whitespace text. */
    public boolean isBlank() {
        return nodes.allSatisfy(node -> node instanceof Node.TextRun run && run.text().isBlank());
    }
}
