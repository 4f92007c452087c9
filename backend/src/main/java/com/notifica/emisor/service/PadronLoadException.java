package com.notifica.emisor.service;

/**
 * A padron load stopped at {@code rowNumber}. Rows before it stay applied; the counts say how many.
 */
public class PadronLoadException extends RuntimeException {

    private final int inserted;
    private final int updated;
    private final int skipped;
    private final int rowNumber;

    public PadronLoadException(String message, int inserted, int updated, int skipped, int rowNumber, Throwable cause) {
        super(message, cause);
        this.inserted = inserted;
        this.updated = updated;
        this.skipped = skipped;
        this.rowNumber = rowNumber;
    }

    public int getInserted() { return inserted; }
    public int getUpdated() { return updated; }
    public int getSkipped() { return skipped; }
    public int getRowNumber() { return rowNumber; }
}
