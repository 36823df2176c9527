package com.acme.leadflow.audit.integrity;

import com.acme.leadflow.audit.util.JsonCodec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.zip.GZIPInputStream;

/**
 * Offline check of a live ({@code .log}) or rotated ({@code .log.gz}) audit file.
 * Unsigned lines count as valid.
 */
public final class IntegrityVerifier {
    static final String PARSE_ERROR = "JSON parse error";
    static final String INVALID_SIGNATURE = "Invalid signature";

    private final IntegritySigner signer;

    public IntegrityVerifier(IntegritySigner signer) {
        this.signer = Objects.requireNonNull(signer, "signer");
    }

    public VerificationReport verify(Path file) throws IOException {
        long total = 0L;
        long valid = 0L;
        long unsigned = 0L;
        List<VerificationReport.Mismatch> mismatches = new ArrayList<>();
        try (BufferedReader reader = open(file)) {
            String line;
            long lineNumber = 0L;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                total++;
                Map<String, Object> row;
                try {
                    row = JsonCodec.readMap(line);
                } catch (IOException e) {
                    mismatches.add(new VerificationReport.Mismatch(lineNumber, PARSE_ERROR));
                    continue;
                }
                if (!(row.get("signature") instanceof String)) {
                    unsigned++;
                    valid++;
                    continue;
                }
                if (signer.verify(row)) {
                    valid++;
                } else {
                    mismatches.add(new VerificationReport.Mismatch(lineNumber, INVALID_SIGNATURE));
                }
            }
        }
        return new VerificationReport(file, total, valid, unsigned, mismatches);
    }

    private static BufferedReader open(Path file) throws IOException {
        InputStream in = Files.newInputStream(file);
        if (file.getFileName().toString().endsWith(".gz")) {
            try {
                in = new GZIPInputStream(in);
            } catch (IOException e) {
                in.close();
                throw e;
            }
        }
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }
}
