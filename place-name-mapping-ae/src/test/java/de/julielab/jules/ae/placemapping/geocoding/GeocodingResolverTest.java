package de.julielab.jules.ae.placemapping.geocoding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import de.julielab.jules.ae.placemapping.PlaceMappingConfiguration;
import de.julielab.jules.ae.placemapping.TestKnowledgeBase;
import de.julielab.jules.ae.placemapping.knowledge.Gazetteer;
import de.julielab.jules.ae.placemapping.knowledge.GazetteerEntry;
import de.julielab.jules.ae.placemapping.knowledge.KnowledgeBase;
import de.julielab.jules.ae.placemapping.textmodel.AcceptedMention;
import de.julielab.jules.ae.placemapping.textmodel.GeocodedRecord;
import de.julielab.jules.ae.placemapping.textmodel.MentionCategory;
import de.julielab.jules.ae.placemapping.textmodel.SentenceContext;
import de.julielab.jules.ae.placemapping.utils.norm.PlaceNameNormalizer;

class GeocodingResolverTest {

    private final KnowledgeBase kb = TestKnowledgeBase.defaults();
    private final PlaceNameNormalizer normalizer = new PlaceNameNormalizer();
    private ExternalGeocodingProvider provider;
    private GeocodingResolver resolver;

    @BeforeEach
    void setup() throws Exception {
        PlaceMappingConfiguration config = new PlaceMappingConfiguration();
        config.setProperty(PlaceMappingConfiguration.GEOCODING_MIN_DELAY_MS, "0");
        provider = mock(ExternalGeocodingProvider.class);
        when(provider.getProviderId()).thenReturn("mock");
        when(provider.geocode(anyString(), any())).thenReturn(Optional.empty());
        resolver = new GeocodingResolver(layers(config));
    }

    private List<ResolverLayer> layers(PlaceMappingConfiguration config) {
        List<ResolverLayer> layers = new ArrayList<>();
        for (Gazetteer gazetteer : kb.getGazetteers())
            layers.add(new CuratedGazetteerLayer(gazetteer, normalizer));
        layers.add(new ClassicalPlaceLayer(kb, normalizer, 0.9));
        layers.add(new AmbiguousNameHintLayer(kb));
        layers.add(new ExternalProviderLayer(provider, new GeocodingCache(100), normalizer, config));
        return layers;
    }

    private static AcceptedMention mention(String name, String sentence, double confidence, MentionCategory label,
                                           String region) {
        int begin = sentence.indexOf(name);
        return new AcceptedMention(name, begin, begin + name.length(), confidence, "regex", label, "test",
                new SentenceContext("doc", sentence), region);
    }

    @Test
    void historicalProvinceResolvesToModernRegion() {
        GeocodedRecord record = resolver.resolve(mention("伊勢", "伊勢の神宮へ参拝に出かけた。", 0.9,
                MentionCategory.HISTORICAL_PROVINCE, "三重県伊勢市"));

        assertThat(record.isResolved()).isTrue();
        assertThat(record.getResolutionSource()).isEqualTo("classical");
        assertThat(record.getCanonicalName()).isEqualTo("三重県伊勢市");
        assertThat(record.getLatitude()).isCloseTo(34.49, within(1e-4));
        assertThat(record.getConfidence()).isCloseTo(0.81, within(1e-9));
    }

    @Test
    void curatedGazetteerComesFirst() throws Exception {
        GeocodedRecord record = resolver.resolve(mention("本郷", "本郷の下宿に戻った。", 1.0, MentionCategory.PLACE, null));

        assertThat(record.getResolutionSource()).isEqualTo("tokyo_detail");
        assertThat(record.getRegionHint()).isEqualTo("東京都文京区");
        assertThat(record.getConfidence()).isCloseTo(0.95, within(1e-9));
        verify(provider, never()).geocode(anyString(), any());
    }

    @Test
    void gazetteerLookupUsesNormalizedName() {
        GeocodedRecord record = resolver.resolve(mention("ﾛｰﾏ", "ﾛｰﾏに着いた。", 0.8, MentionCategory.PLACE, null));

        assertThat(record.getResolutionSource()).isEqualTo("foreign");
        assertThat(record.getCanonicalName()).isEqualTo("ローマ");
    }

    @Test
    void nonPlaceIsNotResolved() throws Exception {
        GeocodedRecord record = resolver.resolve(mention("萩", "萩が延びている。", 0.25, MentionCategory.PLANT, null));

        assertThat(record.isResolved()).isFalse();
        assertThat(record.getResolutionSource()).isEqualTo(GeocodedRecord.SOURCE_REJECTED);
        assertThat(record.getConfidence()).isZero();
        verify(provider, never()).geocode(anyString(), any());
    }

    @Test
    void unknownPlaceFails() throws Exception {
        GeocodedRecord record = resolver.resolve(mention("架空町", "架空町へ行く。", 0.9, MentionCategory.PLACE, null));

        assertThat(record.isResolved()).isFalse();
        assertThat(record.getLatitude()).isNull();
        assertThat(record.getResolutionSource()).isEqualTo(GeocodedRecord.SOURCE_FAILED);
        assertThat(record.getConfidence()).isZero();
        verify(provider).geocode("架空町", null);
    }

    @Test
    void providerAnswersWhenCuratedTablesDoNot() throws Exception {
        when(provider.geocode("船橋市", "千葉県")).thenReturn(Optional.of(new ProviderResult(35.69, 139.98, 0.7, null)));

        GeocodedRecord record = resolver.resolve(mention("船橋市", "船橋市に住む。", 1.0, MentionCategory.PLACE, "千葉県"));

        assertThat(record.getResolutionSource()).isEqualTo("mock_with_context");
        assertThat(record.getConfidence()).isCloseTo(0.7, within(1e-9));
    }

    @Test
    void ambiguousNameGetsRegionHint() throws Exception {
        resolver.resolve(mention("柏", "柏に着いた。", 0.9, MentionCategory.PLACE, null));

        verify(provider).geocode("柏", "千葉県柏市");
    }

    @Test
    void failingLayerIsSkipped() {
        ResolverLayer broken = mock(ResolverLayer.class);
        when(broken.getName()).thenReturn("broken");
        when(broken.tryResolve(any(), any())).thenThrow(new IllegalStateException("corrupt table"));
        List<ResolverLayer> layers = new ArrayList<>();
        layers.add(broken);
        layers.add(new ClassicalPlaceLayer(kb, normalizer, 0.9));
        GeocodingResolver resolverWithBrokenLayer = new GeocodingResolver(layers);

        GeocodedRecord record = resolverWithBrokenLayer.resolve(mention("伊勢国", "伊勢国の旅人。", 0.9,
                MentionCategory.HISTORICAL_PROVINCE, null));

        assertThat(record.getResolutionSource()).isEqualTo("classical");
    }

    @Test
    void confidenceStaysWithinBounds() {
        for (String name : List.of("本郷", "伊勢", "架空町", "パリ")) {
            GeocodedRecord record = resolver.resolve(mention(name, name + "へ。", 1.0, MentionCategory.HISTORICAL_PROVINCE, null));
            assertThat(record.getConfidence()).isBetween(0.0, 1.0);
        }
    }

    @Test
    void replacedTablesAreUsed() {
        KnowledgeBase custom = KnowledgeBase.builder(kb)
                .clearGazetteers()
                .gazetteer(new Gazetteer("village_survey", 0.5,
                        Map.of("架空町", new GazetteerEntry("架空町", 35.1, 135.2, "架空県"))))
                .clearClassicalPlaces()
                .build();
        List<ResolverLayer> layers = new ArrayList<>();
        for (Gazetteer gazetteer : custom.getGazetteers())
            layers.add(new CuratedGazetteerLayer(gazetteer, normalizer));
        layers.add(new ClassicalPlaceLayer(custom, normalizer, 0.9));
        GeocodingResolver customResolver = new GeocodingResolver(layers);

        GeocodedRecord village = customResolver.resolve(mention("架空町", "架空町へ行く。", 0.9, MentionCategory.PLACE, null));
        GeocodedRecord ise = customResolver.resolve(mention("伊勢", "伊勢の神宮。", 0.9,
                MentionCategory.HISTORICAL_PROVINCE, "三重県伊勢市"));

        assertThat(village.getResolutionSource()).isEqualTo("village_survey");
        assertThat(village.getConfidence()).isCloseTo(0.45, within(1e-9));
        assertThat(village.getRegionHint()).isEqualTo("架空県");
        assertThat(ise.isResolved()).isFalse();
        assertThat(kb.getGazetteers()).hasSizeGreaterThan(1);
    }
}
