package com.notifica.emisor.model;

/** Page size in centimeters. */
public record PageDimensions(double widthCm, double heightCm) {

    public static final double POINTS_PER_CM = 72.0 / 2.54;

    /** Mexico Oficio. */
    public static final PageDimensions DEFAULT = new PageDimensions(21.59, 34.01);

    public PageDimensions {
        if (widthCm <= 0 || heightCm <= 0) {
            throw new IllegalArgumentException("Page dimensions must be positive: " + widthCm + "x" + heightCm);
        }
    }

    public float widthPt() { return toPoints(widthCm); }
    public float heightPt() { return toPoints(heightCm); }

    public static float toPoints(double cm) {
        return (float) (cm * POINTS_PER_CM);
    }
}
