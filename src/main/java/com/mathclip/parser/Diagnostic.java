package com.mathclip.parser;

/**
 * A recoverable anomaly noticed during conversion. Diagnostics never stop a conversion.
 *
 * @param kind     what was noticed
 * @param subject  the command, environment or separator involved
 * @param position source offset, or -1 when the tree no longer carries one
 */
public record Diagnostic(Kind kind, String subject, int position) {

    public enum Kind {
        UNKNOWN_COMMAND_ARITY,
        UNKNOWN_ENVIRONMENT,
        DEGENERATE_ENVIRONMENT_ROW,
        STRAY_SEPARATOR
    }

    @Override
    public String toString() {
        return position >= 0
            ? kind + " '" + subject + "' at " + position
            : kind + " '" + subject + "'";
    }
}
