package com.notifica.emisor.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Fits text into a fixed box: single line, then word wrap, then shrinking by 1pt down to
 * {@link #MIN_FONT_SIZE}, and finally truncation. Width measurement is supplied by the caller
 * so the algorithm stays independent of the PDF library.
 */
public class TextFitter {

    public static final float MIN_FONT_SIZE = 8f;
    public static final float LINE_HEIGHT_FACTOR = 1.2f;
    static final int TRUNCATE_LENGTH = 30;
    static final String ELLIPSIS = "...";

    @FunctionalInterface
    public interface WidthMeasurer {
        float width(String text, float fontSize);
    }

    private final WidthMeasurer measurer;

    public TextFitter(WidthMeasurer measurer) {
        this.measurer = measurer;
    }

    public FittedText fit(String text, float boxWidth, float boxHeight, float declaredSize) {
        String value = text == null ? "" : text;
        if (measurer.width(value, declaredSize) <= boxWidth) {
            return new FittedText(List.of(value), declaredSize, FittedText.Mode.SINGLE_LINE);
        }

        // the declared size is always tried once, even below the shrink floor
        float size = declaredSize;
        while (true) {
            List<String> lines = wrap(value, size, boxWidth);
            if (allFit(lines, size, boxWidth) && lines.size() * size * LINE_HEIGHT_FACTOR <= boxHeight) {
                FittedText.Mode mode = size == declaredSize ? FittedText.Mode.WRAPPED : FittedText.Mode.SHRUNK;
                return new FittedText(lines, size, mode);
            }
            if (size - 1f < MIN_FONT_SIZE) break;
            size -= 1f;
        }

        float floor = Math.min(MIN_FONT_SIZE, declaredSize);
        return new FittedText(List.of(truncate(value, floor, boxWidth)), floor, FittedText.Mode.TRUNCATED);
    }

    /** Greedy word wrap; a single word wider than the box stays alone on its line. */
    List<String> wrap(String text, float size, float boxWidth) {
        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String word : text.trim().split("\\s+")) {
            if (word.isEmpty()) continue;
            if (current.length() == 0) {
                current.append(word);
                continue;
            }
            String candidate = current + " " + word;
            if (measurer.width(candidate, size) <= boxWidth) {
                current.setLength(0);
                current.append(candidate);
            } else {
                lines.add(current.toString());
                current.setLength(0);
                current.append(word);
            }
        }
        if (current.length() > 0) lines.add(current.toString());
        return lines;
    }

    private boolean allFit(List<String> lines, float size, float boxWidth) {
        for (String line : lines) {
            if (measurer.width(line, size) > boxWidth) return false;
        }
        return true;
    }

    private String truncate(String text, float size, float boxWidth) {
        String head = text.length() > TRUNCATE_LENGTH ? text.substring(0, TRUNCATE_LENGTH) : text;
        String candidate = head.length() < text.length() ? head + ELLIPSIS : head;
        while (measurer.width(candidate, size) > boxWidth && !head.isEmpty()) {
            head = head.substring(0, head.length() - 1);
            candidate = head + ELLIPSIS;
        }
        return candidate;
    }
}
