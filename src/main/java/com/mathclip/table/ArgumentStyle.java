package com.mathclip.table;

public enum ArgumentStyle {
    /** Arguments are brace groups only. */
    BRACED,
    /** One argument: a brace group, a single character or a single command. */
    TOKEN
}
