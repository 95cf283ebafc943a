package com.mathclip.parser;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the diagnostics of a single conversion.
 */
public class Diagnostics {
    private static final Logger logger = LoggerFactory.getLogger(Diagnostics.class);

    private final MutableList<Diagnostic> entries = Lists.mutable.empty();

    public void report(Diagnostic.Kind kind, String subject, int position) {
        Diagnostic diagnostic = new Diagnostic(kind, subject, position);
        logger.debug("{}", diagnostic);
        entries.add(diagnostic);
    }

    public ImmutableList<Diagnostic> toList() {
        return entries.toImmutable();
    }

    public boolean contains(Diagnostic.Kind kind) {
        return entries.anySatisfy(d -> d.kind() == kind);
    }
}
