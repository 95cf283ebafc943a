package com.mathclip.normalize;

import com.mathclip.parser.Diagnostics;
import com.mathclip.parser.Node;

/**
 * Runs the whitespace collapse and the piecewise rewrite over a parsed tree. The two
 * passes touch disjoint concerns, so their order does not matter.
 */
public class Normalizer {
    private final WhitespaceCollapser whitespace = new WhitespaceCollapser();
    private final PiecewiseRewriter piecewise = new PiecewiseRewriter();

    public Node.Group normalize(Node.Group tree, Diagnostics diagnostics) {
        return piecewise.rewrite(whitespace.collapse(tree), diagnostics);
    }

    public Node.Group normalize(Node.Group tree) {
        return normalize(tree, new Diagnostics());
    }
}
