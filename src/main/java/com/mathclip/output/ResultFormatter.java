package com.mathclip.output;

import com.mathclip.ConversionResult;
import com.mathclip.parser.Diagnostic;

public class ResultFormatter {
    private final OutputFormat format;
    private final boolean prettyPrint;

    // StringBuilder pool for performance
    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public ResultFormatter(OutputFormat format) {
        this(format, true);
    }

    public ResultFormatter(OutputFormat format, boolean prettyPrint) {
        this.format = format;
        this.prettyPrint = prettyPrint;
    }

    public String format(ConversionResult result) {
        return switch (format) {
            case PLAIN -> result.plainText();
            case MATHML -> result.markup();
            case HTML -> HtmlDocument.wrap(result.markup());
            case BOTH -> result.plainText() + "\n\n" + result.markup();
            case JSON -> formatJson(result);
        };
    }

    private String formatJson(ConversionResult result) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0); // Clear the builder

        String newline = prettyPrint ? "\n" : "";
        String indent = prettyPrint ? "  " : "";
        String colon = prettyPrint ? ": " : ":";

        sb.append("{").append(newline);
        sb.append(indent).append("\"plainText\"").append(colon);
        appendString(result.plainText(), sb);
        sb.append(",").append(newline);
        sb.append(indent).append("\"markup\"").append(colon);
        appendString(result.markup(), sb);
        sb.append(",").append(newline);
        sb.append(indent).append("\"diagnostics\"").append(colon);

        if (result.diagnostics().isEmpty()) {
            sb.append("[]");
        } else {
            sb.append("[").append(newline);
            boolean first = true;
            for (Diagnostic diagnostic : result.diagnostics()) {
                if (!first) {
                    sb.append(",").append(newline);
                }
                first = false;
                sb.append(indent).append(indent);
                appendString(diagnostic.toString(), sb);
            }
            sb.append(newline).append(indent).append("]");
        }

        sb.append(newline).append("}");
        return sb.toString();
    }

    private void appendString(String s, StringBuilder sb) {
        sb.append("\"").append(escapeString(s)).append("\"");
    }

    private String escapeString(String s) {
        // Fast path: if no escaping needed, return original
        boolean needsEscaping = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' || c == '"' || c < 0x20) {
                needsEscaping = true;
                break;
            }
        }

        if (!needsEscaping) {
            return s;
        }

        StringBuilder result = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> result.append("\\\\");
                case '"'  -> result.append("\\\"");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                default   -> {
                    if (c < 0x20) {
                        result.append(String.format("\\u%04x", (int) c));
                    } else {
                        result.append(c);
                    }
                }
            }
        }
        return result.toString();
    }
}
