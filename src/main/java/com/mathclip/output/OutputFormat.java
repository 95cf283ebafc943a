package com.mathclip.output;

public enum OutputFormat {
    PLAIN,
    MATHML,
    HTML,
    BOTH,
    JSON
}
