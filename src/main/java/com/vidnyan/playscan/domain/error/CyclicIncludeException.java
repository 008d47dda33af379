package com.vidnyan.playscan.domain.error;

import java.util.List;

/**
 * A role or file includes itself, directly or transitively.
 */
public class CyclicIncludeException extends AnalysisException {

    private final List<String> cycle;

    public CyclicIncludeException(List<String> cycle) {
        super("Cyclic include detected: " + String.join(" → ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
