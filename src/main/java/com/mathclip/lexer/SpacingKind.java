package com.mathclip.lexer;

import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

/**
 * The fixed set of spacing commands the lexer recognises, with the control
 * names that select each one.
 */
public enum SpacingKind {
    THIN("0.1667em", ",", "thinspace"),
    MEDIUM("0.2222em", ":", ">", "medspace"),
    THICK("0.2778em", ";", "thickspace"),
    NEGATIVE_THIN("-0.1667em", "!", "negthinspace"),
    QUAD("1em", "quad"),
    QQUAD("2em", "qquad"),
    // "\ " and "~", both non-breaking
    EXPLICIT("0.25em", " ", "~");

    private static final ImmutableMap<String, SpacingKind> BY_NAME;

    static {
        MutableMap<String, SpacingKind> names = Maps.mutable.empty();
        for (SpacingKind kind : values()) {
            for (String name : kind.names) {
                names.put(name, kind);
            }
        }
        BY_NAME = names.toImmutable();
    }

    private final String width;
    private final String[] names;

    SpacingKind(String width, String... names) {
        this.width = width;
        this.names = names;
    }

    /** Width as a MathML length. */
    public String width() {
        return width;
    }

    /** The control name used when the spacing is rebuilt as a command, e.g. {@code quad}. */
    public String controlName() {
        return names[0];
    }

    public static SpacingKind forName(String name) {
        return BY_NAME.get(name);
    }
}
