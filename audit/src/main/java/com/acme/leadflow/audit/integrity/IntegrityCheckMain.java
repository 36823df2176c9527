package com.acme.leadflow.audit.integrity;

import com.acme.leadflow.audit.util.AuditDefaults;
import com.acme.leadflow.audit.util.AuditEnvKeys;
import com.acme.leadflow.audit.util.EnvVars;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Ops entry point: {@code IntegrityCheckMain <log file> [secret file]}.
 * Exits with status 2 when any line fails verification.
 */
public final class IntegrityCheckMain {
    private IntegrityCheckMain() {
    }

    public static void main(String[] args) throws Exception {
        Path logFile = args.length > 0
            ? Path.of(args[0])
            : Path.of(EnvVars.getOrDefault(AuditEnvKeys.AUDIT_LOG_FILE, AuditDefaults.DEFAULT_LOG_FILE));
        if (!Files.exists(logFile)) {
            throw new IllegalArgumentException("audit log file not found: " + logFile);
        }
        IntegritySigner signer = resolveSigner(args, logFile);
        VerificationReport report = new IntegrityVerifier(signer).verify(logFile);
        System.out.println(render(report));
        if (!report.intact()) {
            System.exit(2);
        }
    }

    static IntegritySigner resolveSigner(String[] args, Path logFile) {
        if (args.length > 1) {
            return new IntegritySigner(SecretKeyStore.load(Path.of(args[1])));
        }
        String explicit = System.getenv(AuditEnvKeys.AUDIT_SECRET_KEY);
        if (explicit != null && !explicit.isBlank()) {
            return new IntegritySigner(explicit.trim());
        }
        String configured = System.getenv(AuditEnvKeys.AUDIT_SECRET_FILE);
        Path secretFile = configured != null && !configured.isBlank()
            ? Path.of(configured)
            : siblingSecret(logFile);
        if (!Files.exists(secretFile)) {
            throw new IllegalArgumentException("audit secret file not found: " + secretFile);
        }
        return new IntegritySigner(SecretKeyStore.load(secretFile));
    }

    static String render(VerificationReport report) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("file=").append(report.file()).append('\n');
        sb.append("total=").append(report.totalLines())
            .append(" valid=").append(report.validLines())
            .append(" invalid=").append(report.invalidLines())
            .append(" unsigned=").append(report.unsignedLines()).append('\n');
        for (VerificationReport.Mismatch m : report.mismatches()) {
            sb.append("line ").append(m.lineNumber()).append(": ").append(m.reason()).append('\n');
        }
        sb.append(report.intact() ? "status=OK" : "status=TAMPERED");
        return sb.toString();
    }

    private static Path siblingSecret(Path logFile) {
        Path parent = logFile.toAbsolutePath().getParent();
        return parent == null ? Path.of(AuditDefaults.SECRET_FILE_NAME) : parent.resolve(AuditDefaults.SECRET_FILE_NAME);
    }
}
