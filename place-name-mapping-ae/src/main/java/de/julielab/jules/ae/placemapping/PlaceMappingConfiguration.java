package de.julielab.jules.ae.placemapping;

import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import de.julielab.java.utilities.FileUtilities;
import de.julielab.jules.ae.placemapping.utils.PlaceMapperRuntimeException;

public class PlaceMappingConfiguration extends Properties {
	/**
	 *
	 */
	private static final long serialVersionUID = 5063177940622845160L;

	/**
	 * Prefix of table locations that denote a classpath resource. All other
	 * locations are files.
	 */
	public static final String CLASSPATH_PREFIX = "classpath:";

	/*
	 * knowledge tables
	 */
	public static final String REGIONS_TABLE = "regions_table";
	public static final String SUFFIX_CLASSES_TABLE = "suffix_classes_table";
	public static final String BOUNDARY_TABLE = "boundary_table";
	public static final String NON_PLACE_RULES_TABLE = "non_place_rules_table";
	public static final String PLACE_INDICATORS_TABLE = "place_indicators_table";
	public static final String PERSON_INDICATORS_TABLE = "person_indicators_table";
	public static final String HISTORICAL_INDICATORS_TABLE = "historical_indicators_table";
	public static final String AMBIGUOUS_NAMES_TABLE = "ambiguous_names_table";
	public static final String CLASSICAL_PLACES_TABLE = "classical_places_table";
	public static final String EXTRACTOR_PROFILES_TABLE = "extractor_profiles_table";
	public static final String DENY_LIST_TABLE = "deny_list_table";
	public static final String FAMOUS_PLACES_TABLE = "famous_places_table";
	/**
	 * Comma separated gazetteer identifiers. For each identifier <tt>id</tt> the
	 * properties <tt>gazetteer.id.table</tt> and <tt>gazetteer.id.confidence</tt>
	 * are read.
	 */
	public static final String GAZETTEERS = "gazetteers";
	public static final String GAZETTEER_PREFIX = "gazetteer.";

	/*
	 * extraction
	 */
	public static final String EXTRACTORS = "extractors";
	public static final String NER_SOURCE = "ner_source";
	public static final String BOUNDARY_WINDOW = "boundary_window";
	public static final String REGEX_PREFECTURE_CONFIDENCE = "regex_prefecture_confidence";
	public static final String REGEX_MUNICIPALITY_CONFIDENCE = "regex_municipality_confidence";
	public static final String REGEX_COUNTY_CONFIDENCE = "regex_county_confidence";
	public static final String REGEX_FAMOUS_PLACE_CONFIDENCE = "regex_famous_place_confidence";
	public static final String REGEX_LOCATION_CONTEXT_BONUS = "regex_location_context_bonus";
	public static final String REGEX_PERSON_CONTEXT_PENALTY = "regex_person_context_penalty";

	/*
	 * coordination
	 */
	public static final String CLASSIFICATION_ENABLED = "classification_enabled";
	public static final String TRUSTED_SOURCE_VALIDATION = "trusted_source_validation";
	public static final String PLACE_CONFIDENCE_BOOST = "place_confidence_boost";
	public static final String NON_PLACE_CONFIDENCE_PENALTY = "non_place_confidence_penalty";
	public static final String UNVALIDATED_CONFIDENCE_FACTOR = "unvalidated_confidence_factor";
	public static final String DEGRADED_CONFIDENCE_FACTOR = "degraded_confidence_factor";

	/*
	 * classification
	 */
	public static final String DEFAULT_PLACE_BIAS = "default_place_bias";
	public static final String HISTORICAL_BONUS = "historical_bonus";
	public static final String PERSON_SCORE_THRESHOLD = "person_score_threshold";
	public static final String AMBIGUOUS_PERSON_THRESHOLD = "ambiguous_person_threshold";
	public static final String AMBIGUOUS_MIN_LIKELIHOOD = "ambiguous_min_likelihood";
	public static final String AMBIGUOUS_PERSON_CONFIDENCE = "ambiguous_person_confidence";
	public static final String HISTORICAL_CONFIDENCE = "historical_confidence";
	public static final String DEFAULT_CLASSIFICATION_CONFIDENCE = "default_classification_confidence";
	public static final String SCORED_CONFIDENCE_BASE = "scored_confidence_base";
	public static final String SCORED_CONFIDENCE_STEP = "scored_confidence_step";
	public static final String SCORED_CONFIDENCE_CAP = "scored_confidence_cap";

	/*
	 * geocoding
	 */
	public static final String CLASSICAL_LAYER_CONFIDENCE = "classical_layer_confidence";
	public static final String GEOCODING_PROVIDER = "geocoding_provider";
	public static final String GEOCODING_MIN_DELAY_MS = "geocoding_min_delay_ms";
	public static final String GEOCODING_MAX_ATTEMPTS = "geocoding_max_attempts";
	public static final String GEOCODING_BACKOFF_MS = "geocoding_backoff_ms";
	public static final String GEOCODING_BACKOFF_MULTIPLIER = "geocoding_backoff_multiplier";
	public static final String GEOCODING_CACHE_SIZE = "geocoding_cache_size";
	public static final String NOMINATIM_URL = "nominatim_url";
	public static final String NOMINATIM_USER_AGENT = "nominatim_user_agent";
	public static final String NOMINATIM_TIMEOUT_MS = "nominatim_timeout_ms";
	public static final String NOMINATIM_COUNTRY_CODES = "nominatim_country_codes";

	/*
	 * batch processing
	 */
	public static final String BATCH_WORKERS = "batch_workers";

	public PlaceMappingConfiguration() {
	}

	public PlaceMappingConfiguration(File configurationFile) throws IOException {
		try (Reader reader = new InputStreamReader(FileUtilities.getInputStreamFromFile(configurationFile),
				StandardCharsets.UTF_8)) {
			this.load(reader);
		}
	}

	/**
	 * Returns the table location configured for <tt>key</tt>. If nothing is
	 * configured, the table shipped in the <tt>knowledge</tt> resource directory
	 * is used.
	 */
	public String getTableLocation(String key, String defaultResourceName) {
		return getProperty(key, CLASSPATH_PREFIX + "/knowledge/" + defaultResourceName);
	}

	public double getDouble(String key, double defaultValue) {
		String value = getProperty(key);
		if (value == null || value.isBlank())
			return defaultValue;
		try {
			return Double.parseDouble(value.trim());
		} catch (NumberFormatException e) {
			throw new PlaceMapperRuntimeException("The value \"" + value + "\" of property " + key + " is not a number.", e);
		}
	}

	public int getInt(String key, int defaultValue) {
		String value = getProperty(key);
		if (value == null || value.isBlank())
			return defaultValue;
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new PlaceMapperRuntimeException("The value \"" + value + "\" of property " + key + " is not an integer.", e);
		}
	}

	public boolean getBoolean(String key, boolean defaultValue) {
		String value = getProperty(key);
		if (value == null || value.isBlank())
			return defaultValue;
		return Boolean.parseBoolean(value.trim());
	}

}
