package com.mathclip.render;

import com.mathclip.parser.Node;

@FunctionalInterface
public interface EnvironmentHandler {
    void render(Node.Environment environment, EnvironmentWriter writer);
}
