package com.mathclip.table;

/**
 * One environment entry: its kind and the fences each output puts around it.
 */
public record EnvironmentSpec(String name,
                              EnvironmentKind kind,
                              String plainOpen,
                              String plainClose,
                              String markupOpen,
                              String markupClose,
                              boolean columnSpec) {

    /** Unrecognised environments fall back to a bracketed grid. */
    public static EnvironmentSpec fallback(String name) {
        return new EnvironmentSpec(name, EnvironmentKind.GRID, "[", "]", "[", "]", false);
    }
}
