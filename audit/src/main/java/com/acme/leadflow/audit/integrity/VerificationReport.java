package com.acme.leadflow.audit.integrity;

import java.nio.file.Path;
import java.util.List;

public record VerificationReport(
    Path file,
    long totalLines,
    long validLines,
    long unsignedLines,
    List<Mismatch> mismatches
) {
    public VerificationReport {
        mismatches = List.copyOf(mismatches);
    }

    public long invalidLines() {
        return mismatches.size();
    }

    public boolean intact() {
        return mismatches.isEmpty();
    }

    public record Mismatch(long lineNumber, String reason) {}
}
