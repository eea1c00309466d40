package com.iimsoft.bom.exception;

import java.util.List;

public class AmbiguousRootException extends IllegalStateException {

    private final List<String> candidates;

    public AmbiguousRootException(List<String> candidates) {
        super("Multiple root rows (level == 0): " + candidates);
        this.candidates = List.copyOf(candidates);
    }

    public List<String> getCandidates() {
        return candidates;
    }
}
