package com.mathclip;

import com.mathclip.lexer.MathLexer;
import com.mathclip.lexer.Token;
import com.mathclip.normalize.Normalizer;
import com.mathclip.parser.Diagnostics;
import com.mathclip.parser.MathParser;
import com.mathclip.parser.Node;
import com.mathclip.render.MathMlRenderer;
import com.mathclip.render.PlainTextRenderer;
import com.mathclip.render.TreeRenderer;
import com.mathclip.table.CommandTable;
import org.eclipse.collections.api.list.MutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts LaTeX math markup to plain text and MathML.
 * <p>
 * Each call parses the input once and renders the same normalised tree twice, so the
 * two outputs never disagree structurally. Instances hold no per-call state.
 */
public class MathConverter {
    private static final Logger logger = LoggerFactory.getLogger(MathConverter.class);

    private final MathLexer lexer = new MathLexer();
    private final MathParser parser;
    private final Normalizer normalizer = new Normalizer();
    private final TreeRenderer plainTextRenderer;
    private final TreeRenderer markupRenderer = new MathMlRenderer();

    public MathConverter() {
        this(CommandTable.builtIn(), PlainTextRenderer.DEFAULT_STATEMENT_SEPARATOR);
    }

    public MathConverter(CommandTable table, String statementSeparator) {
        this.parser = new MathParser(table);
        this.plainTextRenderer = new PlainTextRenderer(statementSeparator);
    }

    public ConversionResult convert(String rawMarkup) throws ConversionException {
        Diagnostics diagnostics = new Diagnostics();
        Node.Group tree = parse(rawMarkup, diagnostics);

        String plainText = plainTextRenderer.render(tree);
        String markup = markupRenderer.render(tree);

        return new ConversionResult(plainText, markup, diagnostics.toList());
    }

    /**
     * Lexes, parses and normalises {@code rawMarkup} without rendering it.
     */
    public Node.Group parse(String rawMarkup, Diagnostics diagnostics) throws ConversionException {
        MutableList<Token> tokens = lexer.tokenize(rawMarkup);
        logger.debug("Lexed {} tokens", tokens.size());
        return normalizer.normalize(parser.parse(tokens, diagnostics), diagnostics);
    }
}
