package de.julielab.jules.ae.placemapping.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import de.julielab.jules.ae.placemapping.PlaceMappingConfiguration;
import de.julielab.jules.ae.placemapping.TestKnowledgeBase;
import de.julielab.jules.ae.placemapping.classification.ContextClassifier;
import de.julielab.jules.ae.placemapping.classification.RuleBasedContextClassifier;
import de.julielab.jules.ae.placemapping.knowledge.KnowledgeBase;
import de.julielab.jules.ae.placemapping.textmodel.AcceptedMention;
import de.julielab.jules.ae.placemapping.textmodel.Candidate;
import de.julielab.jules.ae.placemapping.textmodel.MentionCategory;
import de.julielab.jules.ae.placemapping.textmodel.SentenceContext;
import de.julielab.jules.ae.placemapping.utils.ClassificationException;
import de.julielab.jules.ae.placemapping.utils.ExtractionException;
import de.julielab.jules.ae.placemapping.utils.KnowledgeTableException;

class ExtractionCoordinatorTest {

    private final KnowledgeBase kb = TestKnowledgeBase.defaults();
    private final PlaceMappingConfiguration config = new PlaceMappingConfiguration();

    private ExtractionCoordinator coordinator(List<PlaceExtractor> extractors, ContextClassifier classifier)
            throws KnowledgeTableException {
        return new ExtractionCoordinator(extractors, classifier, kb, config);
    }

    private ExtractionCoordinator coordinator() throws KnowledgeTableException {
        return coordinator(List.of(), new RuleBasedContextClassifier(kb, config));
    }

    private static Candidate candidate(SentenceContext context, String text, String source, double confidence) {
        return candidate(context, text, context.getSentenceText().indexOf(text), source, confidence);
    }

    private static Candidate candidate(SentenceContext context, String text, int begin, String source,
                                       double confidence) {
        return new Candidate(text, begin, begin + text.length(), source, confidence, context, null);
    }

    @Nested
    @DisplayName("representative selection")
    class Selection {
        private final SentenceContext sentence = new SentenceContext("doc", "千葉県船橋市に住む。");

        @Test
        void higherPrioritySourceWins() throws Exception {
            CoordinationResult result = coordinator().coordinate(sentence,
                    List.of(candidate(sentence, "千葉県船橋市", "ner", 0.6), candidate(sentence, "千葉県船橋市", "pattern", 0.9)));

            assertThat(result.getAccepted()).hasSize(1);
            AcceptedMention mention = result.getAccepted().get(0);
            assertThat(mention.getPlaceName()).isEqualTo("千葉県船橋市");
            assertThat(mention.getSourceMethod()).isEqualTo("pattern");
            assertThat(mention.getConfidence()).isEqualTo(0.9);
            assertThat(mention.getClassificationLabel()).isEqualTo(MentionCategory.PLACE);
            assertThat(mention.getReasoning()).contains("also found by ner");
            assertThat(result.getRejected()).isEmpty();
        }

        @Test
        void containedLowerTrustMentionIsRemoved() throws Exception {
            CoordinationResult result = coordinator().coordinate(sentence,
                    List.of(candidate(sentence, "船橋市", "regex", 0.9), candidate(sentence, "千葉県船橋市", "pattern", 0.9)));

            assertThat(result.getAccepted()).extracting(AcceptedMention::getPlaceName).containsExactly("千葉県船橋市");
        }

        @Test
        void repeatedNameKeepsItsStandaloneOccurrence() throws Exception {
            SentenceContext sentence = new SentenceContext("doc", "福岡県京都郡真崎村の者だ。京都は遠い。");
            CoordinationResult result = coordinator().coordinate(sentence, List.of(
                    candidate(sentence, "京都", 3, "regex", 0.85),
                    candidate(sentence, "京都", 13, "regex", 0.85),
                    candidate(sentence, "福岡県京都郡真崎村", 0, "pattern", 0.95)));

            assertThat(result.getAccepted()).extracting(AcceptedMention::getPlaceName)
                    .containsExactly("福岡県京都郡真崎村", "京都");
            assertThat(result.getAccepted().get(1).getBegin()).isEqualTo(13);
            assertThat(result.getAccepted().get(1).getSourceMethod()).isEqualTo("regex");
        }

        @Test
        void sourcesAreMergedPerOccurrence() throws Exception {
            SentenceContext sentence = new SentenceContext("doc", "京都から京都へ戻った。");
            CoordinationResult result = coordinator().coordinate(sentence, List.of(
                    candidate(sentence, "京都", 0, "regex", 0.85),
                    candidate(sentence, "京都", 0, "ner", 0.7),
                    candidate(sentence, "京都", 4, "ner", 0.7)));

            assertThat(result.getAccepted()).extracting(AcceptedMention::getBegin).containsExactly(0, 4);
            assertThat(result.getAccepted()).extracting(AcceptedMention::getSourceMethod).containsExactly("regex", "ner");
            assertThat(result.getAccepted().get(0).getReasoning()).contains("also found by ner");
        }

        @Test
        void resultDoesNotDependOnCandidateOrder() throws Exception {
            List<Candidate> candidates = new ArrayList<>(List.of(candidate(sentence, "千葉県船橋市", "pattern", 0.9),
                    candidate(sentence, "千葉県船橋市", "ner", 0.7), candidate(sentence, "船橋市", "regex", 0.9),
                    candidate(sentence, "船橋", "ner", 0.7)));
            ExtractionCoordinator coordinator = coordinator();
            CoordinationResult expected = coordinator.coordinate(sentence, candidates);

            Collections.reverse(candidates);
            assertThat(coordinator.coordinate(sentence, candidates)).isEqualTo(expected);
            assertThat(coordinator.coordinate(sentence, candidates)).isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("classification of lower trust sources")
    class Classification {

        @Test
        void placeIsBoosted() throws Exception {
            SentenceContext sentence = new SentenceContext("doc", "東京へ行った。");
            CoordinationResult result = coordinator().coordinate(sentence, List.of(candidate(sentence, "東京", "regex", 0.75)));

            assertThat(result.getAccepted()).hasSize(1);
            assertThat(result.getAccepted().get(0).getConfidence()).isCloseTo(0.9, within(1e-9));
        }

        @Test
        void boostIsCappedAtOne() throws Exception {
            SentenceContext sentence = new SentenceContext("doc", "東京へ行った。");
            CoordinationResult result = coordinator().coordinate(sentence, List.of(candidate(sentence, "東京", "regex", 0.95)));

            assertThat(result.getAccepted().get(0).getConfidence()).isEqualTo(1.0);
        }

        @Test
        void plantIsRejected() throws Exception {
            SentenceContext sentence = new SentenceContext("doc", "萩が延びている。");
            CoordinationResult result = coordinator().coordinate(sentence, List.of(candidate(sentence, "萩", "regex", 0.85)));

            assertThat(result.getAccepted()).isEmpty();
            assertThat(result.getRejected()).hasSize(1);
            AcceptedMention rejected = result.getRejected().get(0);
            assertThat(rejected.getClassificationLabel()).isEqualTo(MentionCategory.PLANT);
            assertThat(rejected.getConfidence()).isCloseTo(0.255, within(1e-9));
        }

        @Test
        void belowTrustThresholdIsRejected() throws Exception {
            SentenceContext sentence = new SentenceContext("doc", "東京へ行った。");
            CoordinationResult result = coordinator().coordinate(sentence, List.of(candidate(sentence, "東京", "ner", 0.5)));

            assertThat(result.getAccepted()).isEmpty();
            assertThat(result.getRejected()).extracting(AcceptedMention::getPlaceName).containsExactly("東京");
        }

        @Test
        void historicalProvinceCarriesModernRegion() throws Exception {
            SentenceContext sentence = new SentenceContext("doc", "伊勢の神宮へ参拝に出かけた。");
            CoordinationResult result = coordinator().coordinate(sentence, List.of(candidate(sentence, "伊勢", "regex", 0.85)));

            AcceptedMention mention = result.getAccepted().get(0);
            assertThat(mention.getClassificationLabel()).isEqualTo(MentionCategory.HISTORICAL_PROVINCE);
            assertThat(mention.getSuggestedModernRegion()).isEqualTo("三重県伊勢市");
        }

        @Test
        void trustedSourceIsValidatedWhenConfigured() throws Exception {
            config.setProperty(PlaceMappingConfiguration.TRUSTED_SOURCE_VALIDATION, "true");
            SentenceContext sentence = new SentenceContext("doc", "萩が延びている。");
            CoordinationResult result = coordinator().coordinate(sentence, List.of(candidate(sentence, "萩", "pattern", 0.9)));

            assertThat(result.getAccepted()).isEmpty();
            assertThat(result.getRejected()).hasSize(1);
        }

        @Test
        void disabledClassificationReducesConfidence() throws Exception {
            config.setProperty(PlaceMappingConfiguration.CLASSIFICATION_ENABLED, "false");
            SentenceContext sentence = new SentenceContext("doc", "萩が延びている。");
            CoordinationResult result = coordinator(List.of(), null).coordinate(sentence,
                    List.of(candidate(sentence, "萩", "regex", 0.85)));

            assertThat(result.getAccepted()).hasSize(1);
            assertThat(result.getAccepted().get(0).getConfidence()).isCloseTo(0.68, within(1e-9));
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        void failingExtractorIsSkipped() throws Exception {
            PlaceExtractor failing = mock(PlaceExtractor.class);
            when(failing.getSourceMethod()).thenReturn("ner");
            when(failing.extract(any())).thenThrow(new ExtractionException("recognizer unavailable"));
            ExtractionCoordinator coordinator = coordinator(List.of(failing, new CompoundPlaceExtractor(kb, config)),
                    new RuleBasedContextClassifier(kb, config));

            CoordinationResult result = coordinator.coordinate(new SentenceContext("doc", "千葉県船橋市に住む。"));

            assertThat(result.getAccepted()).extracting(AcceptedMention::getPlaceName).containsExactly("千葉県船橋市");
        }

        @Test
        void failingClassifierFallsBackToDegradedRule() throws Exception {
            ContextClassifier classifier = mock(ContextClassifier.class);
            when(classifier.classify(anyString(), any())).thenThrow(new ClassificationException("broken"));
            SentenceContext sentence = new SentenceContext("doc", "東の空に東京が見えた。");

            CoordinationResult result = coordinator(List.of(), classifier).coordinate(sentence,
                    List.of(candidate(sentence, "東京", "regex", 0.85), candidate(sentence, "東", "regex", 0.85)));

            assertThat(result.getAccepted()).extracting(AcceptedMention::getPlaceName).containsExactly("東京");
            assertThat(result.getAccepted().get(0).getConfidence()).isCloseTo(0.765, within(1e-9));
            assertThat(result.getRejected()).extracting(AcceptedMention::getClassificationLabel)
                    .containsExactly(MentionCategory.DIRECTION);
        }

        @Test
        void extractorWithoutProfileIsAConfigurationError() {
            PlaceExtractor unknown = mock(PlaceExtractor.class);
            when(unknown.getSourceMethod()).thenReturn("gazetteer_scan");

            assertThatThrownBy(() -> coordinator(List.of(unknown), new RuleBasedContextClassifier(kb, config)))
                    .isInstanceOf(KnowledgeTableException.class);
        }
    }
}
