package com.mathclip;

import com.mathclip.parser.Diagnostic;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * Both renderings of one input, plus the recoverable diagnostics noticed on the way.
 */
public record ConversionResult(String plainText, String markup, ImmutableList<Diagnostic> diagnostics) {
}
