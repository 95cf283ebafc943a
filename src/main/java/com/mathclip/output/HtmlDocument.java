package com.mathclip.output;

import com.mathclip.render.MathMlRenderer;

/**
 * Embeds a MathML fragment in a minimal HTML document, between the fragment markers
 * office applications look for when pasting HTML.
 */
public final class HtmlDocument {
    public static final String START_FRAGMENT = "<!--StartFragment-->";
    public static final String END_FRAGMENT = "<!--EndFragment-->";

    private HtmlDocument() {
    }

    public static String wrap(String mathml) {
        String fragment = mathml.strip();
        if (fragment.isEmpty()) {
            throw new IllegalArgumentException("Empty MathML fragment");
        }
        if (!fragment.contains("<math")) {
            fragment = "<math xmlns=\"" + MathMlRenderer.NAMESPACE + "\">" + fragment + "</math>";
        }
        return "<html><body>\r\n" + START_FRAGMENT + fragment + END_FRAGMENT + "\r\n</body></html>";
    }
}
