package com.mathclip.table;

public enum EnvironmentKind {
    ALIGNMENT,
    PIECEWISE,
    GRID,
    GRID_WITH_RULES
}
