package com.mathclip.lexer;

public sealed interface Token {
    int position();

    record Text(String value, int position) implements Token {}
    record CommandName(String name, int position) implements Token {}
    record GroupOpen(int position) implements Token {}
    record GroupClose(int position) implements Token {}
    record EnvBegin(String name, int position) implements Token {}
    record EnvEnd(String name, int position) implements Token {}
    record RowSep(int position) implements Token {}
    record ColSep(int position) implements Token {}
    record Spacing(SpacingKind kind, int position) implements Token {}
}
