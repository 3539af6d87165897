package ai.msf.roundtrip.model;

import java.util.Objects;

/**
 * State shared by every node of an MSF document tree.
 *
 * <p>The identifier pair is fixed at construction. Everything else is mutated in place by the editing
 * session that owns the tree.
 */
public abstract class MsfEntity {

    private final String primaryId;
    private final String secondaryId;
    private int sequence;
    private boolean verified;
    private boolean review;

    protected MsfEntity(String primaryId, String secondaryId) {
        this.primaryId = Objects.requireNonNull(primaryId, "primaryId");
        this.secondaryId = Objects.requireNonNull(secondaryId, "secondaryId");
    }

    public String primaryId() {
        return primaryId;
    }

    public String secondaryId() {
        return secondaryId;
    }

    public int sequence() {
        return sequence;
    }

    public void setSequence(int sequence) {
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be zero or greater");
        }
        this.sequence = sequence;
    }

    public boolean verified() {
        return verified;
    }

    public void setVerified(boolean verified) {
        this.verified = verified;
    }

    public boolean review() {
        return review;
    }

    public void setReview(boolean review) {
        this.review = review;
    }

    protected boolean sameEntityState(MsfEntity other) {
        return primaryId.equals(other.primaryId)
                && secondaryId.equals(other.secondaryId)
                && sequence == other.sequence
                && verified == other.verified
                && review == other.review;
    }

    protected int entityStateHash() {
        return Objects.hash(primaryId, secondaryId, sequence, verified, review);
    }

    static String textOrEmpty(String value) {
        return value == null ? "" : value;
    }
}
