package com.fiscaladmin.gam.transactionimporter.parser;

import com.fiscaladmin.gam.transactionimporter.mapping.BankProfile;

import java.util.Optional;

/**
 * Outcome of format detection. An unrecognised file is a normal result, not an
 * error: it carries the header line (or a reason) for diagnostics.
 */
public class DetectionResult {

    private final BankProfile profile;
    private final String headerLine;
    private final String reason;

    private DetectionResult(BankProfile profile, String headerLine, String reason) {
        this.profile = profile;
        this.headerLine = headerLine;
        this.reason = reason;
    }

    static DetectionResult recognised(BankProfile profile, String headerLine) {
        return new DetectionResult(profile, headerLine, null);
    }

    static DetectionResult unrecognised(String headerLine, String reason) {
        return new DetectionResult(null, headerLine, reason);
    }

    public boolean isRecognised() {
        return profile != null;
    }

    public Optional<BankProfile> getProfile() {
        return Optional.ofNullable(profile);
    }

    /**
     * Returns the header row joined with commas, or {@code null} if the file had none.
     */
    public String getHeaderLine() {
        return headerLine;
    }

    /**
     * Returns a diagnostic message for an unrecognised file, {@code null} otherwise.
     */
    public String getReason() {
        return reason;
    }
}
