package de.julielab.jules.ae.placemapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import de.julielab.jules.ae.placemapping.textmodel.DocumentMappingResult;

/**
 * Per-document and aggregate counts of a batch run. Thread safe.
 */
public class BatchStatistics {

    /**
     * The counts of one document. A failed document has no counts, only the
     * error message.
     */
    public static class DocumentStatistics {
        private final String documentId;
        private final int acceptedMentions;
        private final int rejectedCandidates;
        private final long geocodingSuccesses;
        private final long geocodingFailures;
        private final String error;

        private DocumentStatistics(String documentId, int acceptedMentions, int rejectedCandidates,
                                   long geocodingSuccesses, long geocodingFailures, String error) {
            this.documentId = documentId;
            this.acceptedMentions = acceptedMentions;
            this.rejectedCandidates = rejectedCandidates;
            this.geocodingSuccesses = geocodingSuccesses;
            this.geocodingFailures = geocodingFailures;
            this.error = error;
        }

        public String getDocumentId() {
            return documentId;
        }

        public int getAcceptedMentions() {
            return acceptedMentions;
        }

        public int getRejectedCandidates() {
            return rejectedCandidates;
        }

        public long getGeocodingSuccesses() {
            return geocodingSuccesses;
        }

        public long getGeocodingFailures() {
            return geocodingFailures;
        }

        public boolean isFailed() {
            return error != null;
        }

        public String getError() {
            return error;
        }

        @Override
        public String toString() {
            if (isFailed())
                return documentId + ": failed (" + error + ")";
            return documentId + ": accepted=" + acceptedMentions + ", rejected=" + rejectedCandidates
                    + ", geocoded=" + geocodingSuccesses + ", not geocoded=" + geocodingFailures;
        }
    }

    private final List<DocumentStatistics> documents = new ArrayList<>();
    private int skippedDocuments;
    private boolean cancelled;

    synchronized void recordCommitted(DocumentMappingResult result) {
        documents.add(new DocumentStatistics(result.getDocumentId(), result.getAcceptedMentions().size(),
                result.getRejectedCandidates(), result.getGeocodingSuccesses(), result.getGeocodingFailures(), null));
    }

    synchronized void recordFailed(String documentId, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        documents.add(new DocumentStatistics(documentId, 0, 0, 0, 0, message));
    }

    synchronized void setSkippedDocuments(int skippedDocuments) {
        this.skippedDocuments = skippedDocuments;
    }

    synchronized void setCancelled(boolean cancelled) {
        this.cancelled = cancelled;
    }

    public synchronized List<DocumentStatistics> getDocumentStatistics() {
        return Collections.unmodifiableList(new ArrayList<>(documents));
    }

    public synchronized int getProcessedDocuments() {
        return (int) documents.stream().filter(d -> !d.isFailed()).count();
    }

    public synchronized int getFailedDocuments() {
        return (int) documents.stream().filter(DocumentStatistics::isFailed).count();
    }

    public synchronized int getSkippedDocuments() {
        return skippedDocuments;
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    public synchronized long getAcceptedMentions() {
        return documents.stream().mapToLong(DocumentStatistics::getAcceptedMentions).sum();
    }

    public synchronized long getRejectedCandidates() {
        return documents.stream().mapToLong(DocumentStatistics::getRejectedCandidates).sum();
    }

    public synchronized long getGeocodingSuccesses() {
        return documents.stream().mapToLong(DocumentStatistics::getGeocodingSuccesses).sum();
    }

    public synchronized long getGeocodingFailures() {
        return documents.stream().mapToLong(DocumentStatistics::getGeocodingFailures).sum();
    }

    @Override
    public synchronized String toString() {
        return "documents processed: " + getProcessedDocuments() + ", failed: " + getFailedDocuments()
                + ", skipped: " + skippedDocuments + (cancelled ? " (cancelled)" : "") + "; accepted mentions: "
                + getAcceptedMentions() + ", rejected candidates: " + getRejectedCandidates()
                + ", geocoded: " + getGeocodingSuccesses() + ", not geocoded: " + getGeocodingFailures();
    }
}
