package de.julielab.jules.ae.placemapping.extraction;

import static de.julielab.jules.ae.placemapping.PlaceMappingConfiguration.*;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.julielab.jules.ae.placemapping.PlaceMappingConfiguration;
import de.julielab.jules.ae.placemapping.classification.ClassificationResult;
import de.julielab.jules.ae.placemapping.classification.ContextClassifier;
import de.julielab.jules.ae.placemapping.knowledge.ExtractorProfile;
import de.julielab.jules.ae.placemapping.knowledge.KnowledgeBase;
import de.julielab.jules.ae.placemapping.textmodel.AcceptedMention;
import de.julielab.jules.ae.placemapping.textmodel.Candidate;
import de.julielab.jules.ae.placemapping.textmodel.MentionCategory;
import de.julielab.jules.ae.placemapping.textmodel.SentenceContext;
import de.julielab.jules.ae.placemapping.utils.ClassificationException;
import de.julielab.jules.ae.placemapping.utils.ExtractionException;
import de.julielab.jules.ae.placemapping.utils.KnowledgeTableException;

/**
 * <p>
 * Merges the candidates of all extractors for one sentence into the final
 * mention list.
 * </p>
 * <p>
 * Candidates with identical text at the same position are grouped and one
 * representative is selected by the priority of its source, then by
 * confidence, then by length.
 * Representatives of the highest-trust source are accepted with their own
 * confidence unless <tt>trusted_source_validation</tt> is switched on.
 * Representatives of all other sources are always classified: places get their
 * confidence boosted, non-places are penalized and rejected. Mentions below the
 * trust threshold of their source are rejected as well. Finally, mentions
 * contained in longer mentions are removed.
 * </p>
 * <p>
 * Extractor failures and classifier failures never abort the sentence. A
 * failing extractor contributes no candidates, a failing classification is
 * replaced by the {@link DegradedClassifier}.
 * </p>
 */
public class ExtractionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ExtractionCoordinator.class);

    private static final Comparator<Candidate> CANONICAL_ORDER = Comparator.comparingInt(Candidate::getBegin)
            .thenComparing(Comparator.comparingInt(Candidate::getLength).reversed())
            .thenComparing(Candidate::getText)
            .thenComparing(Candidate::getSourceMethod)
            .thenComparing(Comparator.comparingDouble(Candidate::getBaseConfidence).reversed());

    private final List<PlaceExtractor> extractors;
    private final ContextClassifier classifier;
    private final DegradedClassifier degradedClassifier;
    private final Map<String, ExtractorProfile> profiles;
    private final String highestTrustSource;
    private final Comparator<Candidate> representativeOrder;

    private final boolean classificationEnabled;
    private final boolean trustedSourceValidation;
    private final double placeConfidenceBoost;
    private final double nonPlaceConfidencePenalty;
    private final double unvalidatedConfidenceFactor;

    /**
     * @param extractors    the extraction strategies, each needs an extractor profile
     * @param classifier    the context classifier; may be <tt>null</tt> if classification is disabled
     * @param knowledgeBase the knowledge base holding the extractor profiles and the deny list
     * @param config        the configuration
     * @throws KnowledgeTableException if an extractor has no profile
     */
    public ExtractionCoordinator(List<PlaceExtractor> extractors, ContextClassifier classifier,
                                 KnowledgeBase knowledgeBase, PlaceMappingConfiguration config) throws KnowledgeTableException {
        this.extractors = List.copyOf(extractors);
        this.classifier = classifier;
        this.profiles = knowledgeBase.getExtractorProfiles();
        for (PlaceExtractor extractor : extractors) {
            if (!profiles.containsKey(extractor.getSourceMethod()))
                throw new KnowledgeTableException("There is no extractor profile for the extraction source "
                        + extractor.getSourceMethod() + ". Known sources: " + profiles.keySet());
        }
        ExtractorProfile highestTrust = knowledgeBase.getHighestTrustProfile();
        if (highestTrust == null)
            throw new KnowledgeTableException("No extractor profiles are defined.");
        this.highestTrustSource = highestTrust.getSource();
        this.representativeOrder = Comparator.comparingInt((Candidate c) -> profile(c).getPriority())
                .thenComparing(Comparator.comparingDouble(Candidate::getBaseConfidence).reversed())
                .thenComparing(Comparator.comparingInt(Candidate::getLength).reversed())
                .thenComparing(CANONICAL_ORDER);

        this.classificationEnabled = config.getBoolean(CLASSIFICATION_ENABLED, true);
        this.trustedSourceValidation = config.getBoolean(TRUSTED_SOURCE_VALIDATION, false);
        this.placeConfidenceBoost = config.getDouble(PLACE_CONFIDENCE_BOOST, 1.2);
        this.nonPlaceConfidencePenalty = config.getDouble(NON_PLACE_CONFIDENCE_PENALTY, 0.3);
        this.unvalidatedConfidenceFactor = config.getDouble(UNVALIDATED_CONFIDENCE_FACTOR, 0.8);
        this.degradedClassifier = new DegradedClassifier(knowledgeBase, config.getDouble(DEGRADED_CONFIDENCE_FACTOR, 0.9));
        if (classificationEnabled && classifier == null)
            throw new IllegalArgumentException("Classification is enabled but no context classifier was given.");
        log.info("Coordinating extractors {} with highest-trust source {}, classification enabled: {}, trusted source validation: {}",
                this.extractors.stream().map(PlaceExtractor::getSourceMethod).collect(Collectors.toList()),
                highestTrustSource, classificationEnabled, trustedSourceValidation);
    }

    /**
     * Runs all extractors on the sentence and coordinates their candidates.
     */
    public CoordinationResult coordinate(SentenceContext context) {
        List<Candidate> candidates = new ArrayList<>();
        for (PlaceExtractor extractor : extractors) {
            try {
                candidates.addAll(extractor.extract(context));
            } catch (ExtractionException | RuntimeException e) {
                log.warn("Extractor {} failed on sentence \"{}\" of document {}; continuing without its candidates.",
                        extractor.getSourceMethod(), context.getSentenceText(), context.getDocumentId(), e);
            }
        }
        return coordinate(context, candidates);
    }

    /**
     * Coordinates the given candidates of one sentence. The result only depends on
     * the candidates, not on their order.
     *
     * @throws IllegalArgumentException if a candidate comes from a source without profile
     */
    public CoordinationResult coordinate(SentenceContext context, List<Candidate> candidates) {
        List<Candidate> sorted = new ArrayList<>(candidates);
        sorted.sort(CANONICAL_ORDER);
        Map<String, List<Candidate>> bySpan = new LinkedHashMap<>();
        for (Candidate candidate : sorted)
            bySpan.computeIfAbsent(groupKey(candidate), k -> new ArrayList<>()).add(candidate);

        List<AcceptedMention> accepted = new ArrayList<>();
        List<AcceptedMention> rejected = new ArrayList<>();
        for (List<Candidate> group : bySpan.values()) {
            Candidate representative = group.stream().min(representativeOrder).get();
            ExtractorProfile profile = profile(representative);
            Judgement judgement = judge(representative);
            AcceptedMention mention = AcceptedMention.of(representative, judgement.confidence, judgement.label,
                    selectionReasoning(representative, group) + "; " + judgement.reasoning, judgement.modernRegion);
            if (!judgement.valid) {
                rejected.add(mention);
            } else if (mention.getConfidence() < profile.getTrustThreshold()) {
                log.debug("Rejecting {} because its confidence is below the trust threshold {} of source {}",
                        mention, profile.getTrustThreshold(), profile.getSource());
                rejected.add(mention);
            } else {
                accepted.add(mention);
            }
        }
        List<AcceptedMention> filtered = ContainmentFilter.filter(accepted);
        rejected.sort(Comparator.comparingInt(AcceptedMention::getBegin).thenComparing(AcceptedMention::getPlaceName));
        if (log.isDebugEnabled())
            log.debug("Sentence \"{}\": {} candidates, accepted {}, rejected {}", context.getSentenceText(),
                    candidates.size(), filtered, rejected);
        return new CoordinationResult(filtered, rejected);
    }

    /**
     * Candidates of different sources for the same text at the same position
     * form one group. A repeated name in the sentence forms a group per
     * occurrence.
     */
    private static String groupKey(Candidate candidate) {
        return candidate.getBegin() + ":" + candidate.getText();
    }

    private ExtractorProfile profile(Candidate candidate) {
        ExtractorProfile profile = profiles.get(candidate.getSourceMethod());
        if (profile == null)
            throw new IllegalArgumentException("Candidate " + candidate + " comes from the source "
                    + candidate.getSourceMethod() + " for which no extractor profile exists.");
        return profile;
    }

    private String selectionReasoning(Candidate representative, List<Candidate> group) {
        StringBuilder sb = new StringBuilder();
        sb.append("selected from ").append(representative.getSourceMethod()).append(" (priority ")
                .append(profile(representative).getPriority()).append(")");
        List<String> others = group.stream().filter(c -> c != representative).map(Candidate::getSourceMethod)
                .distinct().collect(Collectors.toList());
        if (!others.isEmpty())
            sb.append(", also found by ").append(String.join(", ", others));
        return sb.toString();
    }

    private Judgement judge(Candidate candidate) {
        double confidence = candidate.getBaseConfidence();
        boolean trusted = highestTrustSource.equals(candidate.getSourceMethod());
        if (trusted && (!trustedSourceValidation || !classificationEnabled))
            return new Judgement(true, confidence, MentionCategory.PLACE, "boundary-validated trusted source", null);
        if (!classificationEnabled)
            return new Judgement(true, confidence * unvalidatedConfidenceFactor, MentionCategory.PLACE,
                    "not validated, classification disabled", null);

        ClassificationResult result;
        try {
            result = classifier.classify(candidate.getText(), candidate.getSentenceContext());
        } catch (ClassificationException | RuntimeException e) {
            log.warn("Classification of '{}' in document {} failed, using the fallback rule.", candidate.getText(),
                    candidate.getDocumentId(), e);
            ClassificationResult fallback = degradedClassifier.classify(candidate.getText(), confidence);
            if (fallback.isPlace())
                return new Judgement(true, fallback.getConfidence(), fallback.getCategory(), fallback.getReasoning(), null);
            return new Judgement(false, confidence * nonPlaceConfidencePenalty, fallback.getCategory(),
                    fallback.getReasoning(), null);
        }
        String reasoning = "classified as " + result.getCategory() + " with confidence " + result.getConfidence()
                + ": " + result.getReasoning();
        if (result.isPlace())
            return new Judgement(true, Math.min(1, confidence * placeConfidenceBoost), result.getCategory(), reasoning,
                    result.getSuggestedModernRegion());
        return new Judgement(false, confidence * nonPlaceConfidencePenalty, result.getCategory(), reasoning, null);
    }

    private static class Judgement {
        final boolean valid;
        final double confidence;
        final MentionCategory label;
        final String reasoning;
        final String modernRegion;

        Judgement(boolean valid, double confidence, MentionCategory label, String reasoning, String modernRegion) {
            this.valid = valid;
            this.confidence = Math.max(0, Math.min(1, confidence));
            this.label = label;
            this.reasoning = reasoning;
            this.modernRegion = modernRegion;
        }
    }
}
