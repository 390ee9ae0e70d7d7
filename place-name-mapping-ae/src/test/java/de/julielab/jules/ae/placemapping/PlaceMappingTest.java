package de.julielab.jules.ae.placemapping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import de.julielab.jules.ae.placemapping.extraction.CoordinationResult;
import de.julielab.jules.ae.placemapping.geocoding.ExternalGeocodingProvider;
import de.julielab.jules.ae.placemapping.geocoding.ExternalProviderLayer;
import de.julielab.jules.ae.placemapping.geocoding.ProviderResult;
import de.julielab.jules.ae.placemapping.textmodel.AcceptedMention;
import de.julielab.jules.ae.placemapping.textmodel.DocumentMappingResult;
import de.julielab.jules.ae.placemapping.textmodel.GeocodedRecord;
import de.julielab.jules.ae.placemapping.textmodel.MentionCategory;
import de.julielab.jules.ae.placemapping.textmodel.PlaceDocument;
import de.julielab.jules.ae.placemapping.textmodel.SentenceContext;
import de.julielab.jules.ae.placemapping.utils.PlaceMappingException;

class PlaceMappingTest {

    /**
     * Instantiated by class name from the configuration.
     */
    public static class FixedLocationProvider implements ExternalGeocodingProvider {
        public FixedLocationProvider(PlaceMappingConfiguration config) {
        }

        @Override
        public String getProviderId() {
            return "fixed";
        }

        @Override
        public Optional<ProviderResult> geocode(String placeName, String regionHint) {
            return Optional.of(new ProviderResult(33.6, 130.4, 0.8, placeName));
        }
    }

    private PlaceMappingConfiguration config;

    @BeforeEach
    void setup() {
        config = new PlaceMappingConfiguration();
        config.setProperty(PlaceMappingConfiguration.GEOCODING_MIN_DELAY_MS, "0");
    }

    private static PlaceDocument document() {
        return new PlaceDocument("sanshiro", List.of(
                new SentenceContext("sanshiro", "福岡県京都郡真崎村小川三四郎二十三年学生"),
                new SentenceContext("sanshiro", "萩が延びている庭を眺めた。"),
                new SentenceContext("sanshiro", "伊勢の神宮へ参拝に出かけた。")));
    }

    @Test
    void mapsDocument() throws Exception {
        ExternalGeocodingProvider provider = mock(ExternalGeocodingProvider.class);
        when(provider.getProviderId()).thenReturn("mock");
        when(provider.geocode(anyString(), any())).thenReturn(Optional.empty());
        PlaceMapping mapping = new PlaceMapping(config, TestKnowledgeBase.defaults(), null, provider);

        DocumentMappingResult result = mapping.map(document());

        assertThat(result.getDocumentId()).isEqualTo("sanshiro");
        assertThat(result.getAcceptedMentions()).extracting(AcceptedMention::getPlaceName)
                .containsExactly("福岡県京都郡真崎村", "伊勢");
        assertThat(result.getAcceptedMentions().get(1).getClassificationLabel())
                .isEqualTo(MentionCategory.HISTORICAL_PROVINCE);
        assertThat(result.getRejectedCandidates()).isEqualTo(1);
        assertThat(result.getGeocodedRecords()).hasSize(2);
        assertThat(result.getGeocodingSuccesses()).isEqualTo(1);
        assertThat(result.getGeocodingFailures()).isEqualTo(1);

        GeocodedRecord ise = result.getGeocodedRecords().get(1);
        assertThat(ise.getResolutionSource()).isEqualTo("classical");
        assertThat(ise.getConfidence()).isCloseTo(0.9, within(1e-9));
        assertThat(result.getGeocodedRecords().get(0).getResolutionSource()).isEqualTo(GeocodedRecord.SOURCE_FAILED);
    }

    @Test
    void extractsWithoutGeocoding() throws Exception {
        PlaceMapping mapping = new PlaceMapping(config, TestKnowledgeBase.defaults(), null, null);

        CoordinationResult result = mapping.extract(new SentenceContext("doc", "千葉県船橋市に住んでいる。"));

        assertThat(result.getAccepted()).extracting(AcceptedMention::getPlaceName).containsExactly("千葉県船橋市");
        assertThat(mapping.getResolver().getLayers()).noneMatch(l -> l instanceof ExternalProviderLayer);
    }

    @Test
    void nameInsideCompoundAndStandalone() throws Exception {
        PlaceMapping mapping = new PlaceMapping(config, TestKnowledgeBase.defaults(), null, null);

        CoordinationResult result = mapping.extract(new SentenceContext("doc", "福岡県京都郡真崎村の者だ。京都は遠い。"));

        assertThat(result.getAccepted()).extracting(AcceptedMention::getPlaceName)
                .containsExactly("福岡県京都郡真崎村", "京都");
        assertThat(result.getAccepted()).extracting(AcceptedMention::getBegin).containsExactly(0, 13);
    }

    @Test
    void createsConfiguredProviderByClassName() throws Exception {
        config.setProperty(PlaceMappingConfiguration.GEOCODING_PROVIDER, FixedLocationProvider.class.getName());
        PlaceMapping mapping = new PlaceMapping(config);

        CoordinationResult extracted = mapping.extract(new SentenceContext("doc", "千葉県船橋市に住んでいる。"));
        GeocodedRecord record = mapping.resolve(extracted.getAccepted().get(0));

        assertThat(record.getResolutionSource()).isEqualTo("fixed_with_context");
        assertThat(record.getCanonicalName()).isEqualTo("千葉県船橋市");
        assertThat(mapping.getGeocodingCache().size()).isEqualTo(1);
    }

    @Test
    void readsPropertiesFile(@TempDir Path dir) throws Exception {
        Path properties = dir.resolve("placemapping.properties");
        Files.write(properties, List.of(PlaceMappingConfiguration.EXTRACTORS + "=pattern",
                PlaceMappingConfiguration.GAZETTEERS + "=tokyo_detail"), StandardCharsets.UTF_8);

        PlaceMapping mapping = new PlaceMapping(properties.toFile());

        assertThat(mapping.getKnowledgeBase().getGazetteers()).hasSize(1);
        assertThat(mapping.extract(new SentenceContext("doc", "東京へ行った。")).getAccepted()).isEmpty();
    }

    @Test
    void unknownProviderClass() {
        config.setProperty(PlaceMappingConfiguration.GEOCODING_PROVIDER, "de.julielab.NoSuchProvider");

        assertThatThrownBy(() -> new PlaceMapping(config)).isInstanceOf(PlaceMappingException.class)
                .hasMessageContaining(PlaceMappingConfiguration.GEOCODING_PROVIDER);
    }

    @Test
    void unknownExtractor() {
        config.setProperty(PlaceMappingConfiguration.EXTRACTORS, "pattern,gazetteer_scan");

        assertThatThrownBy(() -> new PlaceMapping(config, TestKnowledgeBase.defaults(), null, null))
                .isInstanceOf(PlaceMappingException.class).hasMessageContaining("gazetteer_scan");
    }

    @Test
    void missingPropertiesFile(@TempDir Path dir) {
        File missing = dir.resolve("missing.properties").toFile();

        assertThatThrownBy(() -> new PlaceMapping(missing)).isInstanceOf(Exception.class);
    }
}
