package io.vaultflow.audit;

import java.nio.file.Path;
import java.util.List;

public record AuditReport(
        Path vaultRoot,
        int filesChecked,
        List<Violation> violations
) {
    public AuditReport {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public boolean clean() {
        return violations.isEmpty();
    }

    public List<Violation> violationsFor(Violation.Rule rule) {
        return violations.stream().filter(v -> v.rule() == rule).toList();
    }
}
