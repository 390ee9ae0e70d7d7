/**
 * CompoundPlaceExtractor.java
 *
 * Copyright (c) 2026, JULIE Lab.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Common Public License v1.0
 *
 * Finds hierarchical compound place names like 福岡県京都郡真崎村.
 **/
package de.julielab.jules.ae.placemapping.extraction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.julielab.jules.ae.placemapping.PlaceMappingConfiguration;
import de.julielab.jules.ae.placemapping.knowledge.KnowledgeBase;
import de.julielab.jules.ae.placemapping.knowledge.SuffixClass;
import de.julielab.jules.ae.placemapping.knowledge.SuffixLevel;
import de.julielab.jules.ae.placemapping.textmodel.Candidate;
import de.julielab.jules.ae.placemapping.textmodel.SentenceContext;

/**
 * <p>
 * The highest-trust extractor. For each occurrence of a region name from the
 * region catalogue, the match is extended by an immediately adjacent county and
 * locality (<tt>福岡県京都郡真崎村</tt>) or by an immediately adjacent locality
 * (<tt>千葉県船橋市</tt>). Independently of regions, a city that is immediately
 * followed by a ward is matched (<tt>横浜市中区</tt>).
 * </p>
 * <p>
 * At each start position all possible chains are tried longest first and the
 * first one passing the {@link BoundaryValidator} is taken. Finally, matches
 * contained in longer matches are removed by the {@link ContainmentFilter}.
 * </p>
 */
public class CompoundPlaceExtractor implements PlaceExtractor {
    public static final String SOURCE_METHOD = "pattern";
    private static final Logger log = LoggerFactory.getLogger(CompoundPlaceExtractor.class);

    public enum ChainShape {
        REGION_SUBREGION_LOCALITY(3, 0.95), REGION_LOCALITY(2, 0.90), LOCALITY_WARD(2, 0.85);

        private final int depth;
        private final double confidence;

        ChainShape(int depth, double confidence) {
            this.depth = depth;
            this.confidence = confidence;
        }

        public int getDepth() {
            return depth;
        }

        public double getConfidence() {
            return confidence;
        }

        public String getLabel() {
            return name().toLowerCase();
        }
    }

    private static class Chain {
        final int begin;
        final int end;
        final ChainShape shape;

        Chain(int begin, int end, ChainShape shape) {
            this.begin = begin;
            this.end = end;
            this.shape = shape;
        }

        int length() {
            return end - begin;
        }
    }

    private static final Comparator<Chain> LONGEST_FIRST = Comparator.comparingInt(Chain::length).reversed()
            .thenComparing(Comparator.comparingInt((Chain c) -> c.shape.getDepth()).reversed());

    private final List<String> regions;
    private final SuffixClass subregion;
    private final SuffixClass countyLocality;
    private final SuffixClass locality;
    private final SuffixClass city;
    private final SuffixClass ward;
    private final BoundaryValidator boundaryValidator;

    public CompoundPlaceExtractor(KnowledgeBase knowledgeBase, PlaceMappingConfiguration config) {
        this.regions = knowledgeBase.getRegions();
        this.subregion = knowledgeBase.getSuffixClass(SuffixLevel.SUBREGION);
        this.countyLocality = knowledgeBase.getSuffixClass(SuffixLevel.COUNTY_LOCALITY);
        this.locality = knowledgeBase.getSuffixClass(SuffixLevel.LOCALITY);
        this.city = knowledgeBase.getSuffixClass(SuffixLevel.CITY);
        this.ward = knowledgeBase.getSuffixClass(SuffixLevel.WARD);
        this.boundaryValidator = new BoundaryValidator(knowledgeBase.getBoundaryLexicon(),
                config.getInt(PlaceMappingConfiguration.BOUNDARY_WINDOW, 10));
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
        List<Candidate> matches = new ArrayList<>();
        TreeSet<Integer> wardChainStarts = new TreeSet<>();
        for (String region : regions) {
            int index = sentence.indexOf(region);
            while (index >= 0) {
                int regionEnd = index + region.length();
                wardChainStarts.add(regionEnd);
                addFirstValid(regionChains(sentence, index, regionEnd), context, matches);
                index = sentence.indexOf(region, index + 1);
            }
        }
        for (int i = 0; i < sentence.length(); i++) {
            if (city.isStemChar(sentence.charAt(i)) && (i == 0 || !city.isStemChar(sentence.charAt(i - 1))))
                wardChainStarts.add(i);
        }
        for (Integer start : wardChainStarts)
            addFirstValid(localityWardChains(sentence, start), context, matches);

        List<Candidate> candidates = ContainmentFilter.filter(matches);
        if (log.isDebugEnabled() && !candidates.isEmpty())
            log.debug("Found compound place names {} in sentence {}", candidates, sentence);
        return candidates;
    }

    private List<Chain> regionChains(String sentence, int begin, int regionEnd) {
        List<Chain> chains = new ArrayList<>();
        for (Integer subregionEnd : subregion.matchEnds(sentence, regionEnd)) {
            for (Integer localityEnd : countyLocality.matchEnds(sentence, subregionEnd))
                chains.add(new Chain(begin, localityEnd, ChainShape.REGION_SUBREGION_LOCALITY));
        }
        for (Integer localityEnd : locality.matchEnds(sentence, regionEnd))
            chains.add(new Chain(begin, localityEnd, ChainShape.REGION_LOCALITY));
        return chains;
    }

    private List<Chain> localityWardChains(String sentence, int begin) {
        List<Chain> chains = new ArrayList<>();
        for (Integer cityEnd : city.matchEnds(sentence, begin)) {
            for (Integer wardEnd : ward.matchEnds(sentence, cityEnd))
                chains.add(new Chain(begin, wardEnd, ChainShape.LOCALITY_WARD));
        }
        return chains;
    }

    private void addFirstValid(List<Chain> chains, SentenceContext context, List<Candidate> matches) {
        String sentence = context.getSentenceText();
        chains.sort(LONGEST_FIRST);
        for (Chain chain : chains) {
            if (boundaryValidator.isValid(sentence, chain.begin, chain.end)) {
                matches.add(new Candidate(sentence.substring(chain.begin, chain.end), chain.begin, chain.end,
                        SOURCE_METHOD, chain.shape.getConfidence(), context, chain.shape.getLabel()));
                return;
            }
            log.trace("Rejected {} chain '{}' because of its boundaries", chain.shape,
                    sentence.substring(chain.begin, chain.end));
        }
    }
}
