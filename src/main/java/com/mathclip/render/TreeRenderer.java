package com.mathclip.render;

import com.mathclip.parser.Node;

/**
 * Turns a normalised tree into one output format. Rendering never fails for a tree
 * that parsed.
 */
public interface TreeRenderer {
    String render(Node.Group tree);
}
