package com.mathclip.render;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Column alignments and inner vertical lines read from an {@code array} column
 * specification such as {@code c|cr}. Outer lines and width-taking columns are not kept.
 */
record ColumnSpec(ImmutableList<String> alignments, ImmutableList<String> lines) {

    static ColumnSpec parse(String spec) {
        MutableList<String> alignments = Lists.mutable.empty();
        MutableList<String> lines = Lists.mutable.empty();
        boolean lineBefore = false;

        for (int i = 0; i < spec.length(); i++) {
            char c = spec.charAt(i);
            String alignment = switch (c) {
                case 'l' -> "left";
                case 'c' -> "center";
                case 'r' -> "right";
                default -> null;
            };
            if (alignment != null) {
                if (!alignments.isEmpty()) {
                    lines.add(lineBefore ? "solid" : "none");
                }
                alignments.add(alignment);
                lineBefore = false;
            } else if (c == '|') {
                lineBefore = true;
            }
        }

        return new ColumnSpec(alignments.toImmutable(), lines.toImmutable());
    }

    boolean hasInnerLines() {
        return lines.contains("solid");
    }
}
