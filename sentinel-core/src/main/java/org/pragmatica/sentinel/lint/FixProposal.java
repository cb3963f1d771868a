package org.pragmatica.sentinel.lint;

import org.pragmatica.sentinel.fix.RewritePlan;

/// Outcome of asking a rule's fixer for a rewrite of one diagnostic.
public sealed interface FixProposal {

    Diagnostic diagnostic();

    /// Name of the operation block the violation was found in.
    String block();

    /// A plan was produced. `verified` tells whether re-running detection on the rewritten tree
    /// confirmed the violation is gone.
    record Planned(Diagnostic diagnostic, String block, RewritePlan plan, boolean verified) implements FixProposal {}

    /// No plan; the diagnostic still stands.
    record Skipped(Diagnostic diagnostic, String block, String reason) implements FixProposal {}
}
