package de.julielab.jules.ae.placemapping.textmodel;

import java.util.Collections;
import java.util.List;

/**
 * Everything the mapping produced for one document. This is the unit that is
 * committed to a result sink.
 */
public class DocumentMappingResult {
    private final String documentId;
    private final List<AcceptedMention> acceptedMentions;
    private final List<GeocodedRecord> geocodedRecords;
    private final int rejectedCandidates;

    public DocumentMappingResult(String documentId, List<AcceptedMention> acceptedMentions,
                                 List<GeocodedRecord> geocodedRecords, int rejectedCandidates) {
        this.documentId = documentId;
        this.acceptedMentions = Collections.unmodifiableList(acceptedMentions);
        this.geocodedRecords = Collections.unmodifiableList(geocodedRecords);
        this.rejectedCandidates = rejectedCandidates;
    }

    public String getDocumentId() {
        return documentId;
    }

    public List<AcceptedMention> getAcceptedMentions() {
        return acceptedMentions;
    }

    public List<GeocodedRecord> getGeocodedRecords() {
        return geocodedRecords;
    }

    public int getRejectedCandidates() {
        return rejectedCandidates;
    }

    public long getGeocodingSuccesses() {
        return geocodedRecords.stream().filter(GeocodedRecord::isResolved).count();
    }

    public long getGeocodingFailures() {
        return geocodedRecords.size() - getGeocodingSuccesses();
    }

    @Override
    public String toString() {
        return "DocumentMappingResult [documentId=" + documentId + ", accepted=" + acceptedMentions.size()
                + ", rejected=" + rejectedCandidates + ", geocoded=" + getGeocodingSuccesses() + ", failed="
                + getGeocodingFailures() + "]";
    }
}
