package com.mathclip.lexer;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Splits LaTeX math markup into a flat token sequence.
 * <p>
 * The lexer never fails: anything it does not recognise becomes {@link Token.Text}.
 * Structural problems such as unbalanced braces are left for the parser to report.
 */
public class MathLexer {
    private static final String ESCAPED_LITERALS = "{}&%#$_";

    public MutableList<Token> tokenize(String input) {
        MutableList<Token> tokens = Lists.mutable.empty();
        if (input == null || input.isEmpty()) {
            return tokens;
        }

        String s = input.replace("\r\n", "\n").replace('\r', '\n');
        StringBuilder text = new StringBuilder();
        int textStart = 0;
        int i = 0;

        while (i < s.length()) {
            char c = s.charAt(i);
            int start = i;
            Token token;

            if (c == '\\') {
                if (i + 1 >= s.length()) {
                    // Lone trailing backslash
                    if (text.length() == 0) {
                        textStart = i;
                    }
                    text.append(c);
                    i++;
                    continue;
                }
                char next = s.charAt(i + 1);
                if (Character.isLetter(next)) {
                    int end = i + 1;
                    while (end < s.length() && Character.isLetter(s.charAt(end))) {
                        end++;
                    }
                    if (end < s.length() && s.charAt(end) == '*') {
                        end++;
                    }
                    String name = s.substring(i + 1, end);
                    i = end;

                    if (name.equals("begin") || name.equals("end")) {
                        int braceStart = skipWhitespace(s, i);
                        int braceEnd = braceStart < s.length() && s.charAt(braceStart) == '{'
                            ? s.indexOf('}', braceStart)
                            : -1;
                        if (braceEnd != -1) {
                            String envName = s.substring(braceStart + 1, braceEnd).trim();
                            i = braceEnd + 1;
                            token = name.equals("begin")
                                ? new Token.EnvBegin(envName, start)
                                : new Token.EnvEnd(envName, start);
                        } else {
                            token = new Token.CommandName(name, start);
                        }
                    } else {
                        SpacingKind spacing = SpacingKind.forName(name);
                        token = spacing != null
                            ? new Token.Spacing(spacing, start)
                            : new Token.CommandName(name, start);
                    }
                } else if (next == '\\') {
                    i = skipRowSpacing(s, i + 2);
                    token = new Token.RowSep(start);
                } else if (ESCAPED_LITERALS.indexOf(next) >= 0) {
                    if (text.length() == 0) {
                        textStart = i;
                    }
                    text.append(next);
                    i += 2;
                    continue;
                } else if (next == '|') {
                    if (text.length() == 0) {
                        textStart = i;
                    }
                    text.append('‖');
                    i += 2;
                    continue;
                } else if (next == '(' || next == ')' || next == '[' || next == ']') {
                    // Math-mode delimiters carry no content
                    i += 2;
                    continue;
                } else {
                    SpacingKind spacing = Character.isWhitespace(next)
                        ? SpacingKind.EXPLICIT
                        : SpacingKind.forName(String.valueOf(next));
                    i += 2;
                    token = spacing != null
                        ? new Token.Spacing(spacing, start)
                        : new Token.CommandName(String.valueOf(next), start);
                }
            } else if (c == '{') {
                token = new Token.GroupOpen(i++);
            } else if (c == '}') {
                token = new Token.GroupClose(i++);
            } else if (c == '&') {
                token = new Token.ColSep(i++);
            } else if (c == '~') {
                token = new Token.Spacing(SpacingKind.EXPLICIT, i++);
            } else if (c == '^' || c == '_') {
                token = new Token.CommandName(String.valueOf(c), i++);
            } else if (c == '[' || c == ']') {
                token = new Token.Text(String.valueOf(c), i++);
            } else if (c == '$') {
                i++;
                continue;
            } else {
                if (text.length() == 0) {
                    textStart = i;
                }
                text.append(c);
                i++;
                continue;
            }

            flushText(tokens, text, textStart);
            tokens.add(token);
        }

        flushText(tokens, text, textStart);
        return tokens;
    }

    private void flushText(MutableList<Token> tokens, StringBuilder text, int textStart) {
        if (text.length() > 0) {
            tokens.add(new Token.Text(text.toString(), textStart));
            text.setLength(0);
        }
    }

    private static int skipWhitespace(String s, int i) {
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * Skips an optional extra-spacing length after a row break, as in {@code \\[2pt]}.
     */
    private static int skipRowSpacing(String s, int i) {
        int j = skipWhitespace(s, i);
        if (j < s.length() && s.charAt(j) == '[') {
            int close = s.indexOf(']', j);
            if (close != -1 && s.substring(j + 1, close).matches("\\s*-?[0-9.]+\\s*[a-z]{2}\\s*")) {
                return close + 1;
            }
        }
        return i;
    }
}
