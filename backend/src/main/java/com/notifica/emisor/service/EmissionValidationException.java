package com.notifica.emisor.service;

import java.util.List;

/**
 * Structural problem with an emission request or its CSV. Nothing is rendered when this is thrown.
 */
public class EmissionValidationException extends IllegalArgumentException {

    private final List<String> problems;

    public EmissionValidationException(String message) {
        this(message, List.of());
    }

    public EmissionValidationException(String message, List<String> problems) {
        super(message);
        this.problems = problems == null ? List.of() : List.copyOf(problems);
    }

    public List<String> getProblems() { return problems; }
}
