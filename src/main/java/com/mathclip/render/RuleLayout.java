package com.mathclip.render;

import com.mathclip.parser.Row;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.primitive.ImmutableBooleanList;
import org.eclipse.collections.api.list.primitive.MutableBooleanList;
import org.eclipse.collections.impl.factory.primitive.BooleanLists;

/**
 * Where horizontal rules sit in a table: position {@code i} is the line above row
 * {@code i}, and position {@code rows} is the line below the last row.
 */
public record RuleLayout(ImmutableBooleanList positions) {
    public static final RuleLayout NONE = new RuleLayout(BooleanLists.immutable.empty());

    public static RuleLayout of(ImmutableList<Row> rows) {
        MutableBooleanList positions = BooleanLists.mutable.empty();
        for (int i = 0; i < rows.size(); i++) {
            boolean below = i > 0 && rows.get(i - 1).ruleBelow();
            positions.add(rows.get(i).ruleAbove() || below);
        }
        positions.add(!rows.isEmpty() && rows.getLast().ruleBelow());
        return new RuleLayout(positions.toImmutable());
    }

    public boolean hasRuleAt(int position) {
        return position < positions.size() && positions.get(position);
    }

    public boolean any() {
        return positions.contains(true);
    }
}
