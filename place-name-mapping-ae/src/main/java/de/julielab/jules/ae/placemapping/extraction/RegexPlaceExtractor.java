package de.julielab.jules.ae.placemapping.extraction;

import static de.julielab.jules.ae.placemapping.PlaceMappingConfiguration.*;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.julielab.jules.ae.placemapping.PlaceMappingConfiguration;
import de.julielab.jules.ae.placemapping.knowledge.KnowledgeBase;
import de.julielab.jules.ae.placemapping.knowledge.SuffixClass;
import de.julielab.jules.ae.placemapping.knowledge.SuffixLevel;
import de.julielab.jules.ae.placemapping.textmodel.Candidate;
import de.julielab.jules.ae.placemapping.textmodel.SentenceContext;

/**
 * A lightweight extractor for stand-alone administrative names (prefectures,
 * municipalities, counties not embedded in longer kanji sequences) and for the
 * famous place list. The base confidence of each category is raised when a
 * location particle follows the match and lowered when an honorific follows it.
 * This is a lower-trust source; its candidates are always classified.
 */
public class RegexPlaceExtractor implements PlaceExtractor {
    public static final String SOURCE_METHOD = "regex";
    private static final Logger log = LoggerFactory.getLogger(RegexPlaceExtractor.class);

    private static final Pattern LOCATION_CONTEXT = Pattern.compile("^(?:に|へ|で|から|まで|を|の町|の村|の方)");
    private static final Pattern PERSON_CONTEXT = Pattern.compile("^(?:さん|君|様|氏|先生|殿|ちゃん)");

    private static class CategoryPattern {
        final String category;
        final Pattern pattern;
        final double confidence;

        CategoryPattern(String category, Pattern pattern, double confidence) {
            this.category = category;
            this.pattern = pattern;
            this.confidence = confidence;
        }
    }

    private final List<CategoryPattern> patterns = new ArrayList<>();
    private final double locationBonus;
    private final double personPenalty;

    public RegexPlaceExtractor(KnowledgeBase knowledgeBase, PlaceMappingConfiguration config) {
        SuffixClass municipality = knowledgeBase.getSuffixClass(SuffixLevel.MUNICIPALITY);
        SuffixClass county = knowledgeBase.getSuffixClass(SuffixLevel.COUNTY);
        String stem = municipality.getStemCharClass();

        patterns.add(new CategoryPattern("prefecture", bounded(alternation(knowledgeBase.getRegions()), stem),
                config.getDouble(REGEX_PREFECTURE_CONFIDENCE, 0.85)));
        patterns.add(new CategoryPattern("municipality", bounded(municipality.toRegex(), stem),
                config.getDouble(REGEX_MUNICIPALITY_CONFIDENCE, 0.8)));
        patterns.add(new CategoryPattern("county", bounded(county.toRegex(), stem),
                config.getDouble(REGEX_COUNTY_CONFIDENCE, 0.7)));
        if (!knowledgeBase.getFamousPlaces().isEmpty())
            patterns.add(new CategoryPattern("famous_place", bounded(alternation(knowledgeBase.getFamousPlaces()), stem),
                    config.getDouble(REGEX_FAMOUS_PLACE_CONFIDENCE, 0.85)));
        this.locationBonus = config.getDouble(REGEX_LOCATION_CONTEXT_BONUS, 0.1);
        this.personPenalty = config.getDouble(REGEX_PERSON_CONTEXT_PENALTY, 0.2);
    }

    private static String alternation(List<String> names) {
        return names.stream().sorted(Comparator.comparingInt(String::length).reversed()).map(Pattern::quote)
                .collect(Collectors.joining("|", "(?:", ")"));
    }

    private static Pattern bounded(String regex, String stemCharClass) {
        return Pattern.compile("(?<!" + stemCharClass + ")" + regex + "(?!" + stemCharClass + ")");
    }

    @Override
    public String getSourceMethod() {
        return SOURCE_METHOD;
    }

    @Override
    public List<Candidate> extract(SentenceContext context) {
        String sentence = context.getSentenceText();
        if (sentence.isEmpty())
            return List.of();
        List<Candidate> candidates = new ArrayList<>();
        for (CategoryPattern categoryPattern : patterns) {
            Matcher m = categoryPattern.pattern.matcher(sentence);
            while (m.find()) {
                double confidence = adjustToContext(categoryPattern.confidence, sentence.substring(m.end()));
                candidates.add(new Candidate(m.group(), m.start(), m.end(), SOURCE_METHOD, confidence, context,
                        categoryPattern.category));
            }
        }
        List<Candidate> filtered = ContainmentFilter.filter(candidates);
        if (log.isDebugEnabled() && !filtered.isEmpty())
            log.debug("Found place names {} in sentence {}", filtered, sentence);
        return filtered;
    }

    private double adjustToContext(double confidence, String following) {
        double adjusted = confidence;
        if (LOCATION_CONTEXT.matcher(following).find())
            adjusted += locationBonus;
        if (PERSON_CONTEXT.matcher(following).find())
            adjusted -= personPenalty;
        return Math.max(0, Math.min(1, adjusted));
    }
}
