package de.julielab.jules.ae.placemapping.knowledge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import de.julielab.jules.ae.placemapping.textmodel.MentionCategory;

/**
 * <p>
 * All domain knowledge used by extraction, classification and geocoding: the
 * region catalogue, suffix classes, boundary lexicon, context rules, indicator
 * catalogues, ambiguous names, classical places, gazetteers, extractor profiles
 * and the deny list of the degraded classification fallback.
 * </p>
 * <p>
 * Instances are immutable and shared read-only by all components and threads.
 * The tables are normally read by the {@link KnowledgeBaseLoader}; tests may
 * assemble minimal instances with the {@link Builder}.
 * </p>
 */
public class KnowledgeBase {
    private final List<String> regions;
    private final Map<SuffixLevel, SuffixClass> suffixClasses;
    private final BoundaryLexicon boundaryLexicon;
    private final List<ContextRule> nonPlaceRules;
    private final List<Pattern> placeIndicators;
    private final List<Pattern> personIndicators;
    private final List<Pattern> historicalIndicators;
    private final Map<String, AmbiguousName> ambiguousNames;
    private final Map<String, ClassicalPlace> classicalPlaces;
    private final List<Gazetteer> gazetteers;
    private final Map<String, ExtractorProfile> extractorProfiles;
    private final Map<String, MentionCategory> denyList;
    private final List<String> famousPlaces;

    private KnowledgeBase(Builder builder) {
        this.regions = Collections.unmodifiableList(new ArrayList<>(builder.regions));
        EnumMap<SuffixLevel, SuffixClass> suffixes = new EnumMap<>(SuffixLevel.class);
        suffixes.putAll(builder.suffixClasses);
        this.suffixClasses = Collections.unmodifiableMap(suffixes);
        this.boundaryLexicon = builder.boundaryLexicon != null ? builder.boundaryLexicon : BoundaryLexicon.builder().build();
        this.nonPlaceRules = Collections.unmodifiableList(new ArrayList<>(builder.nonPlaceRules));
        this.placeIndicators = Collections.unmodifiableList(new ArrayList<>(builder.placeIndicators));
        this.personIndicators = Collections.unmodifiableList(new ArrayList<>(builder.personIndicators));
        this.historicalIndicators = Collections.unmodifiableList(new ArrayList<>(builder.historicalIndicators));
        this.ambiguousNames = Collections.unmodifiableMap(new LinkedHashMap<>(builder.ambiguousNames));
        this.classicalPlaces = Collections.unmodifiableMap(new LinkedHashMap<>(builder.classicalPlaces));
        this.gazetteers = Collections.unmodifiableList(new ArrayList<>(builder.gazetteers));
        this.extractorProfiles = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extractorProfiles));
        this.denyList = Collections.unmodifiableMap(new LinkedHashMap<>(builder.denyList));
        this.famousPlaces = Collections.unmodifiableList(new ArrayList<>(builder.famousPlaces));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder initialized with all tables of <tt>base</tt>, for
     * replacing single tables
     */
    public static Builder builder(KnowledgeBase base) {
        Builder b = new Builder();
        b.regions.addAll(base.regions);
        b.suffixClasses.putAll(base.suffixClasses);
        b.boundaryLexicon = base.boundaryLexicon;
        b.nonPlaceRules.addAll(base.nonPlaceRules);
        b.placeIndicators.addAll(base.placeIndicators);
        b.personIndicators.addAll(base.personIndicators);
        b.historicalIndicators.addAll(base.historicalIndicators);
        b.ambiguousNames.putAll(base.ambiguousNames);
        b.classicalPlaces.putAll(base.classicalPlaces);
        b.gazetteers.addAll(base.gazetteers);
        b.extractorProfiles.putAll(base.extractorProfiles);
        b.denyList.putAll(base.denyList);
        b.famousPlaces.addAll(base.famousPlaces);
        return b;
    }

    public List<String> getRegions() {
        return regions;
    }

    /**
     * @throws IllegalStateException if there is no suffix class for <tt>level</tt>
     */
    public SuffixClass getSuffixClass(SuffixLevel level) {
        SuffixClass suffixClass = suffixClasses.get(level);
        if (suffixClass == null)
            throw new IllegalStateException("No suffix class is defined for the hierarchy level " + level);
        return suffixClass;
    }

    public Map<SuffixLevel, SuffixClass> getSuffixClasses() {
        return suffixClasses;
    }

    public BoundaryLexicon getBoundaryLexicon() {
        return boundaryLexicon;
    }

    public List<ContextRule> getNonPlaceRules() {
        return nonPlaceRules;
    }

    public List<Pattern> getPlaceIndicators() {
        return placeIndicators;
    }

    public List<Pattern> getPersonIndicators() {
        return personIndicators;
    }

    public List<Pattern> getHistoricalIndicators() {
        return historicalIndicators;
    }

    public AmbiguousName getAmbiguousName(String name) {
        return ambiguousNames.get(name);
    }

    public Map<String, AmbiguousName> getAmbiguousNames() {
        return ambiguousNames;
    }

    public ClassicalPlace getClassicalPlace(String name) {
        return classicalPlaces.get(name);
    }

    public Map<String, ClassicalPlace> getClassicalPlaces() {
        return classicalPlaces;
    }

    public List<Gazetteer> getGazetteers() {
        return gazetteers;
    }

    public ExtractorProfile getExtractorProfile(String source) {
        return extractorProfiles.get(source);
    }

    public Map<String, ExtractorProfile> getExtractorProfiles() {
        return extractorProfiles;
    }

    /**
     * @return the profile with the lowest priority number or <tt>null</tt> if
     * there are no profiles
     */
    public ExtractorProfile getHighestTrustProfile() {
        return extractorProfiles.values().stream()
                .min(Comparator.comparingInt(ExtractorProfile::getPriority).thenComparing(ExtractorProfile::getSource))
                .orElse(null);
    }

    public MentionCategory getDenyListCategory(String word) {
        return denyList.get(word);
    }

    public Map<String, MentionCategory> getDenyList() {
        return denyList;
    }

    public List<String> getFamousPlaces() {
        return famousPlaces;
    }

    public static class Builder {
        private final List<String> regions = new ArrayList<>();
        private final Map<SuffixLevel, SuffixClass> suffixClasses = new EnumMap<>(SuffixLevel.class);
        private BoundaryLexicon boundaryLexicon;
        private final List<ContextRule> nonPlaceRules = new ArrayList<>();
        private final List<Pattern> placeIndicators = new ArrayList<>();
        private final List<Pattern> personIndicators = new ArrayList<>();
        private final List<Pattern> historicalIndicators = new ArrayList<>();
        private final Map<String, AmbiguousName> ambiguousNames = new LinkedHashMap<>();
        private final Map<String, ClassicalPlace> classicalPlaces = new LinkedHashMap<>();
        private final List<Gazetteer> gazetteers = new ArrayList<>();
        private final Map<String, ExtractorProfile> extractorProfiles = new LinkedHashMap<>();
        private final Map<String, MentionCategory> denyList = new LinkedHashMap<>();
        private final List<String> famousPlaces = new ArrayList<>();

        public Builder regions(List<String> regions) {
            this.regions.clear();
            this.regions.addAll(regions);
            return this;
        }

        public Builder suffixClass(SuffixClass suffixClass) {
            suffixClasses.put(suffixClass.getLevel(), suffixClass);
            return this;
        }

        public Builder boundaryLexicon(BoundaryLexicon boundaryLexicon) {
            this.boundaryLexicon = boundaryLexicon;
            return this;
        }

        public Builder nonPlaceRules(List<ContextRule> rules) {
            nonPlaceRules.clear();
            nonPlaceRules.addAll(rules);
            return this;
        }

        public Builder placeIndicators(List<Pattern> patterns) {
            placeIndicators.clear();
            placeIndicators.addAll(patterns);
            return this;
        }

        public Builder personIndicators(List<Pattern> patterns) {
            personIndicators.clear();
            personIndicators.addAll(patterns);
            return this;
        }

        public Builder historicalIndicators(List<Pattern> patterns) {
            historicalIndicators.clear();
            historicalIndicators.addAll(patterns);
            return this;
        }

        public Builder ambiguousName(AmbiguousName ambiguousName) {
            ambiguousNames.put(ambiguousName.getName(), ambiguousName);
            return this;
        }

        public Builder classicalPlace(ClassicalPlace classicalPlace) {
            classicalPlaces.put(classicalPlace.getName(), classicalPlace);
            return this;
        }

        public Builder clearClassicalPlaces() {
            classicalPlaces.clear();
            return this;
        }

        public Builder gazetteer(Gazetteer gazetteer) {
            gazetteers.add(gazetteer);
            return this;
        }

        public Builder clearGazetteers() {
            gazetteers.clear();
            return this;
        }

        public Builder extractorProfile(ExtractorProfile profile) {
            extractorProfiles.put(profile.getSource(), profile);
            return this;
        }

        public Builder denyListEntry(String word, MentionCategory category) {
            denyList.put(word, category);
            return this;
        }

        public Builder famousPlaces(List<String> places) {
            famousPlaces.clear();
            famousPlaces.addAll(places);
            return this;
        }

        public KnowledgeBase build() {
            return new KnowledgeBase(this);
        }
    }
}
