package de.julielab.jules.ae.placemapping.classification;

import static de.julielab.jules.ae.placemapping.PlaceMappingConfiguration.*;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.julielab.jules.ae.placemapping.PlaceMappingConfiguration;
import de.julielab.jules.ae.placemapping.knowledge.AmbiguousName;
import de.julielab.jules.ae.placemapping.knowledge.ClassicalPlace;
import de.julielab.jules.ae.placemapping.knowledge.ContextRule;
import de.julielab.jules.ae.placemapping.knowledge.KnowledgeBase;
import de.julielab.jules.ae.placemapping.textmodel.MentionCategory;
import de.julielab.jules.ae.placemapping.textmodel.SentenceContext;
import de.julielab.jules.ae.placemapping.utils.ClassificationException;
import de.julielab.jules.ae.placemapping.utils.norm.PlaceNameNormalizer;

/**
 * <p>
 * Rule based place classification on the concatenation of the text before, the
 * sentence and the text after. The checks are done in this order:
 * </p>
 * <ol>
 * <li>The non-place context rules. The first rule in which the candidate
 * participates decides.</li>
 * <li>The classical place table. A classical name whose keywords occur in the
 * context, whose context contains historical indicators or that carries the
 * province marker (<tt>伊勢国</tt>) is a historical province.</li>
 * <li>The ambiguous name table. A name that is also a common personal name is a
 * person if enough person indicators occur.</li>
 * <li>Indicator scoring. Place and person indicators are counted; the place
 * score gets a default bias and a bonus if any historical indicator occurs. The
 * candidate is a place if its adjusted place score exceeds the person score or
 * the person score stays below a threshold.</li>
 * </ol>
 * <p>
 * All constants are configuration properties; the defaults are the values the
 * rules were tuned with.
 * </p>
 */
public class RuleBasedContextClassifier implements ContextClassifier {
    private static final Logger log = LoggerFactory.getLogger(RuleBasedContextClassifier.class);

    private final KnowledgeBase knowledgeBase;
    private final PlaceNameNormalizer normalizer = new PlaceNameNormalizer();

    private final double defaultPlaceBias;
    private final double historicalBonus;
    private final double personScoreThreshold;
    private final double ambiguousPersonThreshold;
    private final double ambiguousMinLikelihood;
    private final double ambiguousPersonConfidence;
    private final double historicalConfidence;
    private final double defaultConfidence;
    private final double scoredConfidenceBase;
    private final double scoredConfidenceStep;
    private final double scoredConfidenceCap;

    public RuleBasedContextClassifier(KnowledgeBase knowledgeBase, PlaceMappingConfiguration config) {
        this.knowledgeBase = knowledgeBase;
        this.defaultPlaceBias = config.getDouble(DEFAULT_PLACE_BIAS, 1);
        this.historicalBonus = config.getDouble(HISTORICAL_BONUS, 1);
        this.personScoreThreshold = config.getDouble(PERSON_SCORE_THRESHOLD, 2);
        this.ambiguousPersonThreshold = config.getDouble(AMBIGUOUS_PERSON_THRESHOLD, 1);
        this.ambiguousMinLikelihood = config.getDouble(AMBIGUOUS_MIN_LIKELIHOOD, 0.3);
        this.ambiguousPersonConfidence = config.getDouble(AMBIGUOUS_PERSON_CONFIDENCE, 0.8);
        this.historicalConfidence = config.getDouble(HISTORICAL_CONFIDENCE, 0.9);
        this.defaultConfidence = config.getDouble(DEFAULT_CLASSIFICATION_CONFIDENCE, 0.7);
        this.scoredConfidenceBase = config.getDouble(SCORED_CONFIDENCE_BASE, 0.5);
        this.scoredConfidenceStep = config.getDouble(SCORED_CONFIDENCE_STEP, 0.1);
        this.scoredConfidenceCap = config.getDouble(SCORED_CONFIDENCE_CAP, 0.9);
    }

    @Override
    public ClassificationResult classify(String candidate, SentenceContext context) throws ClassificationException {
        if (StringUtils.isBlank(candidate))
            throw new ClassificationException("An empty candidate cannot be classified.");
        String fullContext = context.getFullContext();
        try {
            ClassificationResult result = classifyInContext(candidate, fullContext);
            log.debug("Classified '{}' as {}", candidate, result);
            return result;
        } catch (RuntimeException e) {
            throw new ClassificationException("Classification of '" + candidate + "' failed in context " + fullContext, e);
        }
    }

    private ClassificationResult classifyInContext(String candidate, String fullContext) {
        for (ContextRule rule : knowledgeBase.getNonPlaceRules()) {
            if (rule.appliesTo(fullContext, candidate))
                return ClassificationResult.nonPlace(rule.getConfidence(), rule.getCategory(),
                        "context rule for " + rule.getCategory() + " matched: " + rule.getPattern().pattern());
        }

        int historicalScore = count(knowledgeBase.getHistoricalIndicators(), fullContext);
        ClassificationResult historical = classifyHistorical(candidate, fullContext, historicalScore);
        if (historical != null)
            return historical;

        int placeScore = count(knowledgeBase.getPlaceIndicators(), fullContext);
        int personScore = count(knowledgeBase.getPersonIndicators(), fullContext);

        AmbiguousName ambiguousName = knowledgeBase.getAmbiguousName(candidate);
        if (ambiguousName != null && personScore >= ambiguousPersonThreshold
                && ambiguousName.getPersonLikelihood() > ambiguousMinLikelihood)
            return ClassificationResult.nonPlace(ambiguousPersonConfidence, MentionCategory.PERSON,
                    "ambiguous name with person likelihood " + ambiguousName.getPersonLikelihood()
                            + " and person score " + personScore);

        double adjustedPlaceScore = placeScore + defaultPlaceBias + (historicalScore > 0 ? historicalBonus : 0);
        boolean isPlace = adjustedPlaceScore > personScore || personScore < personScoreThreshold;
        int total = placeScore + personScore + historicalScore;
        double confidence = total == 0 ? defaultConfidence
                : Math.min(scoredConfidenceCap, scoredConfidenceBase + total * scoredConfidenceStep);
        String reasoning = "place score " + placeScore + " (adjusted " + adjustedPlaceScore + "), person score "
                + personScore + ", historical score " + historicalScore;
        return isPlace ? ClassificationResult.place(confidence, MentionCategory.PLACE, reasoning)
                : ClassificationResult.nonPlace(confidence, MentionCategory.PERSON, reasoning);
    }

    private ClassificationResult classifyHistorical(String candidate, String fullContext, int historicalScore) {
        String stem = normalizer.stripProvinceMarker(candidate);
        boolean provinceMarker = !stem.equals(candidate) && stem.length() > 1;
        ClassicalPlace classicalPlace = knowledgeBase.getClassicalPlace(candidate);
        if (classicalPlace == null && provinceMarker)
            classicalPlace = knowledgeBase.getClassicalPlace(stem);
        if (classicalPlace == null && !provinceMarker)
            return null;

        String modernRegion = classicalPlace != null ? classicalPlace.getModernRegion() : null;
        if (provinceMarker)
            return new ClassificationResult(true, historicalConfidence, MentionCategory.HISTORICAL_PROVINCE,
                    "classical province name", modernRegion);
        String keyword = classicalPlace.findKeyword(fullContext);
        if (keyword != null)
            return new ClassificationResult(true, historicalConfidence, MentionCategory.HISTORICAL_PROVINCE,
                    "classical place name with context keyword " + keyword, modernRegion);
        if (historicalScore > 0)
            return new ClassificationResult(true, historicalConfidence, MentionCategory.HISTORICAL_PROVINCE,
                    "classical place name in historical context", modernRegion);
        return null;
    }

    private int count(List<Pattern> patterns, String text) {
        int count = 0;
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(text);
            while (m.find())
                ++count;
        }
        return count;
    }
}
