package com.notifica.emisor.service;

/** The artifact history needed to continue the PMO or visita numbering could not be read. */
public class SequenceLookupException extends RuntimeException {
    public SequenceLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
