package com.notifica.emisor.dto;

public record PadronLoadResult(int inserted, int updated, int skipped) {
    public int total() { return inserted + updated + skipped; }
}
