package com.mathclip.render;

import com.mathclip.parser.Node;

/**
 * Single-use traversal shared by the renderers: dispatches on the node variant and hands
 * environments to the handler registered for their kind.
 */
abstract class TreeWalker implements EnvironmentWriter {

    protected void emit(Node node) {
        if (node instanceof Node.TextRun text) {
            emitText(text);
        } else if (node instanceof Node.Command command) {
            emitCommand(command);
        } else if (node instanceof Node.Group group) {
            emitGroup(group);
        } else if (node instanceof Node.Environment environment) {
            EnvironmentHandlers.forKind(environment.kind()).render(environment, this);
        }
    }

    protected void emitAll(Iterable<? extends Node> nodes) {
        for (Node node : nodes) {
            emit(node);
        }
    }

    protected abstract void emitText(Node.TextRun text);

    protected abstract void emitCommand(Node.Command command);

    protected abstract void emitGroup(Node.Group group);
}
