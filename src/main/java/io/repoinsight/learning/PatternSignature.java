package io.repoinsight.learning;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Identity of a finding: which detector reported which kind of pattern where.
 * <p>
 * Two detections with the same detector id, pattern kind, file path and line are the same learned
 * pattern, in this process or any later one, because {@link #patternId()} is a pure function of
 * those four fields.
 *
 * @param detectorId  Id of the reporting detector, e.g. "enhanced-db"
 * @param patternKind Kind of pattern within that detector, e.g. "missing-connection-cleanup"
 * @param location    File and line of the finding
 */
public record PatternSignature(String detectorId, String patternKind, SourceLocation location) {

    private static final int ID_HASH_LENGTH = 16;

    public PatternSignature {
        if (detectorId == null || detectorId.isBlank()) {
            throw new IllegalArgumentException("detectorId cannot be null or blank");
        }
        if (patternKind == null || patternKind.isBlank()) {
            throw new IllegalArgumentException("patternKind cannot be null or blank");
        }
        if (location == null) {
            location = new SourceLocation("", 0);
        }
    }

    public static PatternSignature of(String detectorId, String patternKind, String filePath, int line) {
        return new PatternSignature(detectorId, patternKind, new SourceLocation(filePath, line));
    }

    /**
     * Stable id: {@code <detector>-<kind>-<16 hex chars of sha256("detector:kind:file:line")>}.
     */
    public String patternId() {
        String key = detectorId + ":" + patternKind + ":" + location.filePath() + ":" + location.line();
        return detectorId + "-" + patternKind + "-" + sha256(key).substring(0, ID_HASH_LENGTH);
    }

    /**
     * Full SHA-256 over the signature fields.
     */
    public String signatureHash() {
        return sha256(detectorId + "\n" + patternKind + "\n" + location.filePath() + "\n" + location.line());
    }

    public PatternCategory category() {
        return PatternCategory.forDetector(detectorId);
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
