package com.mathclip.table;

/**
 * How a command is rendered. The kind also supplies the default arity and
 * argument style when the command table leaves them out.
 */
public enum CommandKind {
    /** Text wrapper such as {@code \text}; argument whitespace is preserved. */
    TEXT(1, ArgumentStyle.BRACED, true),
    /** Font style wrapper such as {@code \mathbf}; argument whitespace is preserved. */
    STYLE(1, ArgumentStyle.BRACED, true),
    FRACTION(2, ArgumentStyle.BRACED, false),
    ROOT(1, ArgumentStyle.BRACED, false),
    BINOMIAL(2, ArgumentStyle.BRACED, false),
    FUNCTION(0, ArgumentStyle.BRACED, false),
    SYMBOL(0, ArgumentStyle.BRACED, false),
    SUPERSCRIPT(1, ArgumentStyle.TOKEN, false),
    SUBSCRIPT(1, ArgumentStyle.TOKEN, false),
    /** Sized delimiters such as {@code \left} and {@code \bigl}. */
    DELIMITER(1, ArgumentStyle.TOKEN, false),
    /** Horizontal rule between table rows. */
    RULE(0, ArgumentStyle.BRACED, false),
    SPACING(0, ArgumentStyle.BRACED, false),
    /** Accepted and dropped, e.g. {@code \displaystyle}. */
    IGNORED(0, ArgumentStyle.BRACED, false),
    UNKNOWN(0, ArgumentStyle.BRACED, false);

    private final int defaultArity;
    private final ArgumentStyle defaultArgumentStyle;
    private final boolean preserveSpacingByDefault;

    CommandKind(int defaultArity, ArgumentStyle defaultArgumentStyle, boolean preserveSpacingByDefault) {
        this.defaultArity = defaultArity;
        this.defaultArgumentStyle = defaultArgumentStyle;
        this.preserveSpacingByDefault = preserveSpacingByDefault;
    }

    public int defaultArity() {
        return defaultArity;
    }

    public ArgumentStyle defaultArgumentStyle() {
        return defaultArgumentStyle;
    }

    public boolean preserveSpacingByDefault() {
        return preserveSpacingByDefault;
    }
}
