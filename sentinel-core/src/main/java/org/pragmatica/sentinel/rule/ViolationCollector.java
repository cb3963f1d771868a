package org.pragmatica.sentinel.rule;

import java.util.ArrayList;
import java.util.List;

/// Accumulates violations of one traversal in visit order.
///
/// Owned by the thread running that traversal. No deduplication: the walker visits each node
/// once, so a rule cannot report the same node twice.
public final class ViolationCollector {
    private final List<Violation> violations = new ArrayList<>();

    private ViolationCollector() {}

    public static ViolationCollector violationCollector() {
        return new ViolationCollector();
    }

    public void record(Violation violation) {
        violations.add(violation);
    }

    public int size() {
        return violations.size();
    }

    /// Hand over everything recorded so far and start empty.
    /// The returned list is immutable and can be iterated any number of times.
    public List<Violation> drain() {
        var result = List.copyOf(violations);
        violations.clear();
        return result;
    }
}
