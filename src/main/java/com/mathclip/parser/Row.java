package com.mathclip.parser;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * One environment row. {@code ruleAbove} and {@code ruleBelow} record {@code \hline}
 * markers around the row.
 */
public record Row(ImmutableList<Cell> cells, boolean ruleAbove, boolean ruleBelow, RowForm form) {

    public Row(ImmutableList<Cell> cells, boolean ruleAbove) {
        this(cells, ruleAbove, false, RowForm.CELLS);
    }

    public boolean isBlank() {
        return cells.allSatisfy(Cell::isBlank);
    }

    public Cell cell(int index) {
        return cells.get(index);
    }

    public Row withCells(ImmutableList<Cell> newCells) {
        return new Row(newCells, ruleAbove, ruleBelow, form);
    }

    public Row withForm(RowForm newForm) {
        return new Row(cells, ruleAbove, ruleBelow, newForm);
    }

    public Row withRuleBelow() {
        return new Row(cells, ruleAbove, true, form);
    }
}
