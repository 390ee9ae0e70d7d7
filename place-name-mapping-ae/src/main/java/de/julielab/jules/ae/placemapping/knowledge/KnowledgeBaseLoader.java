package de.julielab.jules.ae.placemapping.knowledge;

import static de.julielab.jules.ae.placemapping.PlaceMappingConfiguration.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.julielab.jules.ae.placemapping.PlaceMappingConfiguration;
import de.julielab.jules.ae.placemapping.knowledge.KnowledgeTableReader.TableRow;
import de.julielab.jules.ae.placemapping.textmodel.MentionCategory;
import de.julielab.jules.ae.placemapping.utils.KnowledgeTableException;

/**
 * Reads all knowledge tables named by a {@link PlaceMappingConfiguration} into
 * a {@link KnowledgeBase}. Any problem with any table is fatal: a missing or
 * partial table would silently suppress all matches of its kind.
 */
public class KnowledgeBaseLoader {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseLoader.class);

    private final PlaceMappingConfiguration config;
    private final KnowledgeTableReader reader = new KnowledgeTableReader();

    public KnowledgeBaseLoader(PlaceMappingConfiguration config) {
        this.config = config;
    }

    public static KnowledgeBase load(PlaceMappingConfiguration config) throws KnowledgeTableException {
        return new KnowledgeBaseLoader(config).load();
    }

    public KnowledgeBase load() throws KnowledgeTableException {
        KnowledgeBase.Builder builder = KnowledgeBase.builder();

        builder.regions(readRegions());
        readSuffixClasses().forEach(builder::suffixClass);
        builder.boundaryLexicon(readBoundaryLexicon());
        builder.nonPlaceRules(readNonPlaceRules());
        builder.placeIndicators(readPatterns("place indicator", config.getTableLocation(PLACE_INDICATORS_TABLE, "place_indicators.txt")));
        builder.personIndicators(readPatterns("person indicator", config.getTableLocation(PERSON_INDICATORS_TABLE, "person_indicators.txt")));
        builder.historicalIndicators(readPatterns("historical indicator", config.getTableLocation(HISTORICAL_INDICATORS_TABLE, "historical_indicators.txt")));
        readAmbiguousNames().forEach(builder::ambiguousName);
        readClassicalPlaces().forEach(builder::classicalPlace);
        readGazetteers().forEach(builder::gazetteer);
        readExtractorProfiles().forEach(builder::extractorProfile);
        readDenyList().forEach(builder::denyListEntry);
        builder.famousPlaces(reader.readLines("famous place", config.getTableLocation(FAMOUS_PLACES_TABLE, "famous_places.txt")));

        KnowledgeBase knowledgeBase = builder.build();
        log.info("Loaded knowledge base with {} regions, {} non-place rules, {} ambiguous names, {} classical places, {} gazetteers ({}), {} extractor profiles and {} famous places",
                knowledgeBase.getRegions().size(), knowledgeBase.getNonPlaceRules().size(),
                knowledgeBase.getAmbiguousNames().size(), knowledgeBase.getClassicalPlaces().size(),
                knowledgeBase.getGazetteers().size(),
                knowledgeBase.getGazetteers().stream().map(Gazetteer::getId).collect(Collectors.joining(", ")),
                knowledgeBase.getExtractorProfiles().size(), knowledgeBase.getFamousPlaces().size());
        return knowledgeBase;
    }

    private List<String> readRegions() throws KnowledgeTableException {
        List<String> regions = reader.readLines("region", config.getTableLocation(REGIONS_TABLE, "regions.txt"));
        // longer names first so that a shorter region never shadows a longer one with the same prefix
        List<String> sorted = new ArrayList<>(regions);
        sorted.sort((r1, r2) -> Integer.compare(r2.length(), r1.length()));
        return sorted;
    }

    private List<SuffixClass> readSuffixClasses() throws KnowledgeTableException {
        String table = "suffix class";
        List<SuffixClass> suffixClasses = new ArrayList<>();
        Set<SuffixLevel> missing = EnumSet.allOf(SuffixLevel.class);
        for (TableRow row : reader.readRows(table, config.getTableLocation(SUFFIX_CLASSES_TABLE, "suffix_classes.tsv"), 5, 5)) {
            SuffixLevel level = SuffixLevel.forName(row.get(0));
            if (level == null)
                throw malformed(table, row, "unknown hierarchy level " + row.get(0) + ", expected one of " + Arrays.toString(SuffixLevel.values()));
            int min = parseInt(table, row, 2);
            int max = parseInt(table, row, 3);
            compile(table, row, row.get(4));
            try {
                suffixClasses.add(new SuffixClass(level, row.get(1), min, max, row.get(4)));
            } catch (IllegalArgumentException e) {
                throw malformed(table, row, e.getMessage());
            }
            missing.remove(level);
        }
        if (!missing.isEmpty())
            throw new KnowledgeTableException("The suffix class table does not define the hierarchy levels " + missing);
        return suffixClasses;
    }

    private BoundaryLexicon readBoundaryLexicon() throws KnowledgeTableException {
        String table = "boundary";
        BoundaryLexicon.Builder builder = BoundaryLexicon.builder();
        for (TableRow row : reader.readRows(table, config.getTableLocation(BOUNDARY_TABLE, "boundary.tsv"), 2, 2)) {
            BoundaryLexicon.Kind kind;
            try {
                kind = BoundaryLexicon.Kind.valueOf(row.get(0).toUpperCase());
            } catch (IllegalArgumentException e) {
                throw malformed(table, row, "unknown boundary kind " + row.get(0));
            }
            builder.add(kind, row.get(1));
        }
        return builder.build();
    }

    private List<ContextRule> readNonPlaceRules() throws KnowledgeTableException {
        String table = "non-place rule";
        List<ContextRule> rules = new ArrayList<>();
        for (TableRow row : reader.readRows(table, config.getTableLocation(NON_PLACE_RULES_TABLE, "non_place_rules.tsv"), 3, 3)) {
            MentionCategory category = MentionCategory.forLabel(row.get(0));
            if (category == null || category.isPlaceType())
                throw malformed(table, row, row.get(0) + " is not a non-place category");
            rules.add(new ContextRule(category, parseConfidence(table, row, 1), compile(table, row, row.get(2))));
        }
        return rules;
    }

    private List<Pattern> readPatterns(String table, String location) throws KnowledgeTableException {
        List<Pattern> patterns = new ArrayList<>();
        for (TableRow row : reader.readRows(table, location, 1, 1))
            patterns.add(compile(table, row, row.get(0)));
        return patterns;
    }

    private List<AmbiguousName> readAmbiguousNames() throws KnowledgeTableException {
        String table = "ambiguous name";
        List<AmbiguousName> names = new ArrayList<>();
        for (TableRow row : reader.readRows(table, config.getTableLocation(AMBIGUOUS_NAMES_TABLE, "ambiguous_names.tsv"), 2, 3))
            names.add(new AmbiguousName(row.get(0), parseConfidence(table, row, 1), row.getOptional(2)));
        return names;
    }

    private List<ClassicalPlace> readClassicalPlaces() throws KnowledgeTableException {
        String table = "classical place";
        List<ClassicalPlace> places = new ArrayList<>();
        for (TableRow row : reader.readRows(table, config.getTableLocation(CLASSICAL_PLACES_TABLE, "classical_places.tsv"), 4, 5)) {
            String keywords = row.getOptional(4);
            List<String> keywordList = keywords == null ? List.of()
                    : Arrays.stream(keywords.split(",")).map(String::trim).filter(StringUtils::isNotEmpty).collect(Collectors.toList());
            places.add(new ClassicalPlace(row.get(0), row.get(1), parseLatitude(table, row, 2), parseLongitude(table, row, 3), keywordList));
        }
        return places;
    }

    private List<Gazetteer> readGazetteers() throws KnowledgeTableException {
        String ids = config.getProperty(GAZETTEERS, "tokyo_detail,kyoto_detail,hokkaido,foreign");
        List<Gazetteer> gazetteers = new ArrayList<>();
        for (String id : ids.split(",")) {
            id = id.trim();
            if (id.isEmpty())
                continue;
            String table = "gazetteer " + id;
            String location = config.getTableLocation(GAZETTEER_PREFIX + id + ".table", "gazetteer_" + id + ".tsv");
            double confidence = config.getDouble(GAZETTEER_PREFIX + id + ".confidence", "foreign".equals(id) ? 0.90 : 0.95);
            Map<String, GazetteerEntry> entries = new LinkedHashMap<>();
            for (TableRow row : reader.readRows(table, location, 3, 4)) {
                GazetteerEntry entry = new GazetteerEntry(row.get(0), parseLatitude(table, row, 1), parseLongitude(table, row, 2), row.getOptional(3));
                entries.put(entry.getName(), entry);
            }
            gazetteers.add(new Gazetteer(id, confidence, entries));
        }
        if (gazetteers.isEmpty())
            throw new KnowledgeTableException("No gazetteers are configured with the property " + GAZETTEERS);
        return gazetteers;
    }

    private List<ExtractorProfile> readExtractorProfiles() throws KnowledgeTableException {
        String table = "extractor profile";
        List<ExtractorProfile> profiles = new ArrayList<>();
        for (TableRow row : reader.readRows(table, config.getTableLocation(EXTRACTOR_PROFILES_TABLE, "extractor_profiles.tsv"), 4, 4))
            profiles.add(new ExtractorProfile(row.get(0), parseInt(table, row, 1), parseConfidence(table, row, 2), parseConfidence(table, row, 3)));
        return profiles;
    }

    private Map<String, MentionCategory> readDenyList() throws KnowledgeTableException {
        String table = "deny list";
        Map<String, MentionCategory> denyList = new LinkedHashMap<>();
        for (TableRow row : reader.readRows(table, config.getTableLocation(DENY_LIST_TABLE, "deny_list.tsv"), 2, 2)) {
            MentionCategory category = MentionCategory.forLabel(row.get(1));
            if (category == null || category.isPlaceType())
                throw malformed(table, row, row.get(1) + " is not a non-place category");
            denyList.put(row.get(0), category);
        }
        return denyList;
    }

    private Pattern compile(String table, TableRow row, String regex) throws KnowledgeTableException {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new KnowledgeTableException("Invalid regular expression in line " + row.getLineNumber() + " of the " + table + " table: " + e.getMessage(), e);
        }
    }

    private int parseInt(String table, TableRow row, int column) throws KnowledgeTableException {
        try {
            return Integer.parseInt(row.get(column));
        } catch (NumberFormatException e) {
            throw malformed(table, row, "column " + (column + 1) + " is not an integer: " + row.get(column));
        }
    }

    private double parseDouble(String table, TableRow row, int column) throws KnowledgeTableException {
        try {
            return Double.parseDouble(row.get(column));
        } catch (NumberFormatException e) {
            throw malformed(table, row, "column " + (column + 1) + " is not a number: " + row.get(column));
        }
    }

    private double parseConfidence(String table, TableRow row, int column) throws KnowledgeTableException {
        return parseBounded(table, row, column, 0, 1);
    }

    private double parseLatitude(String table, TableRow row, int column) throws KnowledgeTableException {
        return parseBounded(table, row, column, -90, 90);
    }

    private double parseLongitude(String table, TableRow row, int column) throws KnowledgeTableException {
        return parseBounded(table, row, column, -180, 180);
    }

    private double parseBounded(String table, TableRow row, int column, double min, double max) throws KnowledgeTableException {
        double value = parseDouble(table, row, column);
        if (value < min || value > max)
            throw malformed(table, row, "column " + (column + 1) + " is not in [" + min + ", " + max + "]: " + value);
        return value;
    }

    private KnowledgeTableException malformed(String table, TableRow row, String problem) {
        return new KnowledgeTableException("Malformed line " + row.getLineNumber() + " in the " + table + " table: " + problem);
    }
}
