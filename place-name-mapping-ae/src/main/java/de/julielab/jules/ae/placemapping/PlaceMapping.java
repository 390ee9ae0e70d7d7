/**
 * PlaceMapping.java
 *
 * Copyright (c) 2026, JULIE Lab.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Common Public License v1.0
 *
 * Entry point of the place name mapping: extraction, coordination,
 * classification and geocoding of place name mentions.
 **/

package de.julielab.jules.ae.placemapping;

import java.io.File;
import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.julielab.jules.ae.placemapping.classification.ContextClassifier;
import de.julielab.jules.ae.placemapping.classification.RuleBasedContextClassifier;
import de.julielab.jules.ae.placemapping.extraction.CompoundPlaceExtractor;
import de.julielab.jules.ae.placemapping.extraction.CoordinationResult;
import de.julielab.jules.ae.placemapping.extraction.ExternalNERSource;
import de.julielab.jules.ae.placemapping.extraction.ExtractionCoordinator;
import de.julielab.jules.ae.placemapping.extraction.NerPlaceExtractor;
import de.julielab.jules.ae.placemapping.extraction.PlaceExtractor;
import de.julielab.jules.ae.placemapping.extraction.RegexPlaceExtractor;
import de.julielab.jules.ae.placemapping.geocoding.AmbiguousNameHintLayer;
import de.julielab.jules.ae.placemapping.geocoding.ClassicalPlaceLayer;
import de.julielab.jules.ae.placemapping.geocoding.CuratedGazetteerLayer;
import de.julielab.jules.ae.placemapping.geocoding.ExternalGeocodingProvider;
import de.julielab.jules.ae.placemapping.geocoding.ExternalProviderLayer;
import de.julielab.jules.ae.placemapping.geocoding.GeocodingCache;
import de.julielab.jules.ae.placemapping.geocoding.GeocodingResolver;
import de.julielab.jules.ae.placemapping.geocoding.ResolverLayer;
import de.julielab.jules.ae.placemapping.knowledge.Gazetteer;
import de.julielab.jules.ae.placemapping.knowledge.KnowledgeBase;
import de.julielab.jules.ae.placemapping.knowledge.KnowledgeBaseLoader;
import de.julielab.jules.ae.placemapping.textmodel.AcceptedMention;
import de.julielab.jules.ae.placemapping.textmodel.DocumentMappingResult;
import de.julielab.jules.ae.placemapping.textmodel.GeocodedRecord;
import de.julielab.jules.ae.placemapping.textmodel.PlaceDocument;
import de.julielab.jules.ae.placemapping.textmodel.SentenceContext;
import de.julielab.jules.ae.placemapping.utils.PlaceMappingException;
import de.julielab.jules.ae.placemapping.utils.norm.PlaceNameNormalizer;

/**
 * <p>
 * Assembles the mapping pipeline from a {@link PlaceMappingConfiguration}: the
 * knowledge base, the extractors, the {@link ExtractionCoordinator} with its
 * context classifier and the {@link GeocodingResolver} with its layers.
 * </p>
 * <p>
 * The external named entity recognizer and the external geocoding provider
 * are either passed in or given as class names by the properties
 * <tt>ner_source</tt> and <tt>geocoding_provider</tt>. Without a geocoding
 * provider, mentions not found in the curated tables fail to resolve.
 * </p>
 * <p>
 * Instances are thread safe. Sentences and documents may be mapped
 * concurrently; the geocoding cache is shared.
 * </p>
 */
public class PlaceMapping {

	private static final Logger LOGGER = LoggerFactory.getLogger(PlaceMapping.class);

	private final PlaceMappingConfiguration config;
	private final KnowledgeBase knowledgeBase;
	private final ExtractionCoordinator coordinator;
	private final GeocodingResolver resolver;
	private final GeocodingCache geocodingCache;

	/**
	 * Main constructor reading the properties file and all knowledge tables
	 * referenced by it.
	 *
	 * @param propertiesFile
	 * @throws IOException
	 * @throws PlaceMappingException
	 */
	public PlaceMapping(File propertiesFile) throws IOException, PlaceMappingException {
		this(loadConfigurationFile(propertiesFile));
	}

	public PlaceMapping(PlaceMappingConfiguration configuration) throws PlaceMappingException {
		this(configuration, KnowledgeBaseLoader.load(configuration),
				instantiate(configuration, PlaceMappingConfiguration.NER_SOURCE, ExternalNERSource.class),
				instantiate(configuration, PlaceMappingConfiguration.GEOCODING_PROVIDER, ExternalGeocodingProvider.class));
	}

	/**
	 * @param configuration      the configuration
	 * @param knowledgeBase      the knowledge tables
	 * @param nerSource          the external named entity recognizer, may be <tt>null</tt>
	 * @param geocodingProvider  the external geocoding provider, may be <tt>null</tt>
	 * @throws PlaceMappingException if the configuration is inconsistent with the knowledge base
	 */
	public PlaceMapping(PlaceMappingConfiguration configuration, KnowledgeBase knowledgeBase,
			ExternalNERSource nerSource, ExternalGeocodingProvider geocodingProvider) throws PlaceMappingException {
		this.config = configuration;
		this.knowledgeBase = knowledgeBase;
		PlaceNameNormalizer normalizer = new PlaceNameNormalizer();

		List<PlaceExtractor> extractors = createExtractors(nerSource);
		ContextClassifier classifier = config.getBoolean(PlaceMappingConfiguration.CLASSIFICATION_ENABLED, true)
				? new RuleBasedContextClassifier(knowledgeBase, config) : null;
		this.coordinator = new ExtractionCoordinator(extractors, classifier, knowledgeBase, config);

		this.geocodingCache = new GeocodingCache(config.getInt(PlaceMappingConfiguration.GEOCODING_CACHE_SIZE, 100000));
		List<ResolverLayer> layers = new ArrayList<>();
		for (Gazetteer gazetteer : knowledgeBase.getGazetteers())
			layers.add(new CuratedGazetteerLayer(gazetteer, normalizer));
		layers.add(new ClassicalPlaceLayer(knowledgeBase, normalizer,
				config.getDouble(PlaceMappingConfiguration.CLASSICAL_LAYER_CONFIDENCE, 0.9)));
		layers.add(new AmbiguousNameHintLayer(knowledgeBase));
		if (geocodingProvider != null)
			layers.add(new ExternalProviderLayer(geocodingProvider, geocodingCache, normalizer, config));
		else
			LOGGER.warn("No external geocoding provider is configured. Place names missing from the curated tables will not be resolved.");
		this.resolver = new GeocodingResolver(layers);
	}

	private static PlaceMappingConfiguration loadConfigurationFile(File propertiesFile) throws IOException {
		if (!propertiesFile.exists()) {
			LOGGER.error("specified properties file {} does not exist!", propertiesFile);
		}
		return new PlaceMappingConfiguration(propertiesFile);
	}

	private List<PlaceExtractor> createExtractors(ExternalNERSource nerSource) throws PlaceMappingException {
		List<String> names = Arrays.stream(config.getProperty(PlaceMappingConfiguration.EXTRACTORS,
				CompoundPlaceExtractor.SOURCE_METHOD + "," + RegexPlaceExtractor.SOURCE_METHOD + "," + NerPlaceExtractor.SOURCE_METHOD)
				.split(",")).map(String::trim).filter(s -> !s.isEmpty()).collect(Collectors.toList());
		List<PlaceExtractor> extractors = new ArrayList<>();
		for (String name : names) {
			switch (name) {
			case CompoundPlaceExtractor.SOURCE_METHOD:
				extractors.add(new CompoundPlaceExtractor(knowledgeBase, config));
				break;
			case RegexPlaceExtractor.SOURCE_METHOD:
				extractors.add(new RegexPlaceExtractor(knowledgeBase, config));
				break;
			case NerPlaceExtractor.SOURCE_METHOD:
				if (nerSource != null)
					extractors.add(new NerPlaceExtractor(nerSource, knowledgeBase.getExtractorProfile(NerPlaceExtractor.SOURCE_METHOD)));
				else
					LOGGER.info("No external NER source is configured, the {} extractor is not used.", name);
				break;
			default:
				throw new PlaceMappingException("Unknown extractor \"" + name + "\" in property "
						+ PlaceMappingConfiguration.EXTRACTORS + ".");
			}
		}
		if (extractors.isEmpty())
			throw new PlaceMappingException("No extractors are configured.");
		return extractors;
	}

	private static <T> T instantiate(PlaceMappingConfiguration config, String property, Class<T> type)
			throws PlaceMappingException {
		String className = config.getProperty(property);
		if (className == null || className.isBlank())
			return null;
		try {
			Object instance = Class.forName(className.trim()).getDeclaredConstructor(PlaceMappingConfiguration.class)
					.newInstance(config);
			return type.cast(instance);
		} catch (InstantiationException | IllegalAccessException | IllegalArgumentException | InvocationTargetException
				| NoSuchMethodException | SecurityException | ClassNotFoundException | ClassCastException e) {
			throw new PlaceMappingException("Could not create the " + property + " " + className, e);
		}
	}

	/*
	 * mapping functions
	 */

	/**
	 * Extracts and coordinates the place name mentions of one sentence without
	 * geocoding them.
	 */
	public CoordinationResult extract(SentenceContext sentence) {
		return coordinator.coordinate(sentence);
	}

	/**
	 * Resolves an accepted mention to coordinates.
	 */
	public GeocodedRecord resolve(AcceptedMention mention) {
		return resolver.resolve(mention);
	}

	/**
	 * Maps all sentences of a document. Only mentions classified as places are
	 * geocoded.
	 */
	public DocumentMappingResult map(PlaceDocument document) {
		List<AcceptedMention> accepted = new ArrayList<>();
		List<GeocodedRecord> records = new ArrayList<>();
		int rejected = 0;
		for (SentenceContext sentence : document.getSentences()) {
			CoordinationResult result = coordinator.coordinate(sentence);
			rejected += result.getRejected().size();
			for (AcceptedMention mention : result.getAccepted()) {
				accepted.add(mention);
				if (mention.isPlace())
					records.add(resolver.resolve(mention));
			}
		}
		DocumentMappingResult documentResult = new DocumentMappingResult(document.getDocumentId(), accepted, records, rejected);
		LOGGER.debug("Mapped document {}: {}", document.getDocumentId(), documentResult);
		return documentResult;
	}

	public PlaceMappingConfiguration getConfiguration() {
		return config;
	}

	public KnowledgeBase getKnowledgeBase() {
		return knowledgeBase;
	}

	public ExtractionCoordinator getCoordinator() {
		return coordinator;
	}

	public GeocodingResolver getResolver() {
		return resolver;
	}

	public GeocodingCache getGeocodingCache() {
		return geocodingCache;
	}
}
