package com.ednataxa.api.resolution;

import java.util.List;

public record DispatchReport(List<KeyOutcome> outcomes) {

    public DispatchReport {
        outcomes = List.copyOf(outcomes);
    }

    public int count(ResolutionPath path) {
        return (int) outcomes.stream().filter(o -> o.path() == path).count();
    }

    public int resolvedCount() {
        return (int) outcomes.stream().filter(o -> o.result().isResolved()).count();
    }

    public int unresolvedCount() {
        return outcomes.size() - resolvedCount();
    }
}
