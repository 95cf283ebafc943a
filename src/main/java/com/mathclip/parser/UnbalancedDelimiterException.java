package com.mathclip.parser;

import com.mathclip.ConversionException;

/**
 * A group or environment was opened or closed without its counterpart.
 */
public class UnbalancedDelimiterException extends ConversionException {
    private final String marker;
    private final int position;

    public UnbalancedDelimiterException(String marker, int position, String detail) {
        super("Unbalanced delimiter " + marker + " at " + position + ": " + detail);
        this.marker = marker;
        this.position = position;
    }

    public String marker() {
        return marker;
    }

    public int position() {
        return position;
    }
}
