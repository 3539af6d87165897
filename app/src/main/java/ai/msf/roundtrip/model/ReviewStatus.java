package ai.msf.roundtrip.model;

/**
 * Editor-side review progress of a function. Never written to the document.
 */
public enum ReviewStatus {
    UNREVIEWED,
    IN_REVIEW,
    REVIEWED
}
