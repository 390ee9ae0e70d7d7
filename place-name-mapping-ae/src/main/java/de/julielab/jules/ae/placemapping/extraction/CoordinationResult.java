package de.julielab.jules.ae.placemapping.extraction;

import java.util.Collections;
import java.util.List;

import de.julielab.jules.ae.placemapping.textmodel.AcceptedMention;

/**
 * The outcome of coordinating the candidates of one sentence. Rejected mentions
 * are those classified as non-places or falling below the trust threshold of
 * their source; they are kept for statistics and auditing.
 */
public class CoordinationResult {
    private final List<AcceptedMention> accepted;
    private final List<AcceptedMention> rejected;

    public CoordinationResult(List<AcceptedMention> accepted, List<AcceptedMention> rejected) {
        this.accepted = Collections.unmodifiableList(accepted);
        this.rejected = Collections.unmodifiableList(rejected);
    }

    public List<AcceptedMention> getAccepted() {
        return accepted;
    }

    public List<AcceptedMention> getRejected() {
        return rejected;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        CoordinationResult that = (CoordinationResult) o;
        return accepted.equals(that.accepted) && rejected.equals(that.rejected);
    }

    @Override
    public int hashCode() {
        return 31 * accepted.hashCode() + rejected.hashCode();
    }

    @Override
    public String toString() {
        return "CoordinationResult [accepted=" + accepted + ", rejected=" + rejected + "]";
    }
}
