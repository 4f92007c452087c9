package com.notifica.emisor.model;

/**
 * Rasterized barcode. {@code symbology} is the one actually used, which differs from the
 * requested one after a fallback to Code128.
 */
public record BarcodeImage(byte[] png, int widthPx, int heightPx, int dpi, String symbology) {

    public float widthPt() { return widthPx * 72f / dpi; }
    public float heightPt() { return heightPx * 72f / dpi; }
}
