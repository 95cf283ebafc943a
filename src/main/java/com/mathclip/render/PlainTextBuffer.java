package com.mathclip.render;

/**
 * Builds plain text where ordinary whitespace collapses: a run of whitespace becomes at
 * most one space, and none is written at the start, after a separator, or at the end.
 * Verbatim text is written exactly as given.
 */
final class PlainTextBuffer {
    private final StringBuilder sb = new StringBuilder();
    private boolean pendingSpace = false;
    private boolean suppressSpace = true;
    private boolean afterWord = false;

    void text(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c)) {
                if (!suppressSpace) {
                    pendingSpace = true;
                }
            } else {
                if (afterWord && Character.isLetterOrDigit(c)) {
                    pendingSpace = true;
                }
                flushSpace();
                sb.append(c);
                suppressSpace = false;
                afterWord = false;
            }
        }
    }

    /**
     * Writes a symbol or function name, kept apart from adjacent letters and digits
     * so that {@code \alpha\beta} reads "alpha beta".
     */
    void word(String s) {
        if (s.isEmpty()) {
            return;
        }
        boolean alphabetic = Character.isLetter(s.charAt(0));
        if (alphabetic && sb.length() > 0 && Character.isLetterOrDigit(sb.charAt(sb.length() - 1))) {
            pendingSpace = true;
        }
        text(s);
        afterWord = Character.isLetter(s.charAt(s.length() - 1));
    }

    void space() {
        if (!suppressSpace) {
            pendingSpace = true;
        }
    }

    void verbatim(String s) {
        if (s.isEmpty()) {
            return;
        }
        if (Character.isWhitespace(s.charAt(0))) {
            // The text brings its own space
            pendingSpace = false;
        }
        flushSpace();
        sb.append(s);
        suppressSpace = Character.isWhitespace(s.charAt(s.length() - 1));
        afterWord = false;
    }

    void separator(String s) {
        pendingSpace = false;
        sb.append(s);
        suppressSpace = true;
        afterWord = false;
    }

    private void flushSpace() {
        if (pendingSpace) {
            sb.append(' ');
            pendingSpace = false;
        }
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
