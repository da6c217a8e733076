package com.marketpulse.backend.exception;

import java.util.List;

/**
 * Invalid required configuration. Thrown during startup only; aborts the process.
 */
public class FatalConfigException extends RuntimeException {
    private final List<String> problems;

    public FatalConfigException(List<String> problems) {
        super("Invalid configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
