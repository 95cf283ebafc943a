package com.mathclip.table;

/**
 * One entry of the command table.
 *
 * @param name            control name without the backslash, e.g. {@code frac}
 * @param kind            rendering kind
 * @param arity           number of mandatory arguments the parser collects
 * @param argumentStyle   whether arguments must be brace groups
 * @param preserveSpacing whether whitespace inside the arguments survives normalisation
 * @param optionalArgument whether a leading {@code [...]} argument is accepted
 * @param plain           plain-text replacement for symbols and functions
 * @param markup          MathML character for symbols
 * @param element         MathML token element for symbols ({@code mi} or {@code mo})
 * @param variant         MathML {@code mathvariant} for text and style commands, may be null
 */
public record CommandSpec(String name,
                          CommandKind kind,
                          int arity,
                          ArgumentStyle argumentStyle,
                          boolean preserveSpacing,
                          boolean optionalArgument,
                          String plain,
                          String markup,
                          String element,
                          String variant) {

    public static CommandSpec of(String name, CommandKind kind) {
        return new CommandSpec(name, kind, kind.defaultArity(), kind.defaultArgumentStyle(),
            kind.preserveSpacingByDefault(), false, null, null, null, null);
    }

    public static CommandSpec unknown(String name) {
        return of(name, CommandKind.UNKNOWN);
    }

    public static CommandSpec spacing(String controlName) {
        return of(controlName, CommandKind.SPACING);
    }

    public String plainOrName() {
        return plain != null ? plain : name;
    }

    public String markupOrPlain() {
        return markup != null ? markup : plainOrName();
    }
}
