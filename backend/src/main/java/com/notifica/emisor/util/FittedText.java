package com.notifica.emisor.util;

import java.util.List;

/**
 * Outcome of fitting a string into a field box: the lines to draw and the size to draw them at.
 */
public record FittedText(List<String> lines, float fontSize, Mode mode) {

    public enum Mode { SINGLE_LINE, WRAPPED, SHRUNK, TRUNCATED }

    public FittedText {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public boolean isSingleLine() {
        return mode == Mode.SINGLE_LINE || mode == Mode.TRUNCATED;
    }

    public float lineHeight() {
        return fontSize * TextFitter.LINE_HEIGHT_FACTOR;
    }
}
