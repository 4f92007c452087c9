package com.notifica.emisor.batch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A fully resolved record handed to a render worker. Workers only read it; padron values may be null.
 */
public record EmissionJob(String account,
                          int printOrder,
                          String visitaCode,
                          String barcodePayload,
                          Map<String, Object> data) {

    public EmissionJob {
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
