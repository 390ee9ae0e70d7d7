package de.julielab.jules.ae.placemapping.knowledge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import de.julielab.jules.ae.placemapping.PlaceMappingConfiguration;
import de.julielab.jules.ae.placemapping.TestKnowledgeBase;
import de.julielab.jules.ae.placemapping.textmodel.MentionCategory;
import de.julielab.jules.ae.placemapping.utils.KnowledgeTableException;

class KnowledgeBaseLoaderTest {

    @Nested
    class DefaultTables {
        private final KnowledgeBase kb = TestKnowledgeBase.defaults();

        @Test
        void loadsAllPrefecturesLongestFirst() {
            assertThat(kb.getRegions()).hasSize(47).contains("北海道", "千葉県", "京都府");
            assertThat(kb.getRegions().get(0)).hasSize(4);
            assertThat(kb.getRegions().get(kb.getRegions().size() - 1)).hasSize(3);
        }

        @Test
        void definesEverySuffixLevel() {
            for (SuffixLevel level : SuffixLevel.values())
                assertThat(kb.getSuffixClass(level)).isNotNull();
        }

        @Test
        void patternExtractorHasTheHighestTrust() {
            assertThat(kb.getHighestTrustProfile().getSource()).isEqualTo("pattern");
            assertThat(kb.getExtractorProfiles()).containsKeys("pattern", "regex", "ner");
        }

        @Test
        void loadsGazetteersInConfiguredOrder() {
            assertThat(kb.getGazetteers()).extracting(Gazetteer::getId)
                    .containsExactly("tokyo_detail", "kyoto_detail", "hokkaido", "foreign");
            assertThat(kb.getGazetteers().get(3).getConfidence()).isEqualTo(0.90);
            assertThat(kb.getGazetteers().get(0).lookup("本郷").getRegion()).isEqualTo("東京都文京区");
        }

        @Test
        void loadsClassicalPlacesWithKeywords() {
            ClassicalPlace ise = kb.getClassicalPlace("伊勢");
            assertThat(ise.getModernRegion()).isEqualTo("三重県伊勢市");
            assertThat(ise.getKeywords()).contains("神宮");
        }

        @Test
        void loadsDenyList() {
            assertThat(kb.getDenyListCategory("萩")).isEqualTo(MentionCategory.PLANT);
            assertThat(kb.getDenyListCategory("東")).isEqualTo(MentionCategory.DIRECTION);
            assertThat(kb.getDenyListCategory("東京")).isNull();
        }
    }

    @Nested
    class MalformedTables {
        @TempDir
        Path dir;

        private PlaceMappingConfiguration config(String key, String fileName, String content) throws IOException {
            Path table = dir.resolve(fileName);
            Files.write(table, content.getBytes(StandardCharsets.UTF_8));
            PlaceMappingConfiguration config = new PlaceMappingConfiguration();
            config.setProperty(key, table.toString());
            return config;
        }

        @Test
        void emptyTable() throws IOException {
            PlaceMappingConfiguration config = config(PlaceMappingConfiguration.REGIONS_TABLE, "regions.txt",
                    "# only a comment\n\n");
            assertThatThrownBy(() -> KnowledgeBaseLoader.load(config)).isInstanceOf(KnowledgeTableException.class)
                    .hasMessageContaining("empty");
        }

        @Test
        void missingFile() {
            PlaceMappingConfiguration config = new PlaceMappingConfiguration();
            config.setProperty(PlaceMappingConfiguration.REGIONS_TABLE, dir.resolve("nothing.txt").toString());
            assertThatThrownBy(() -> KnowledgeBaseLoader.load(config)).isInstanceOf(KnowledgeTableException.class)
                    .hasMessageContaining("does not exist");
        }

        @Test
        void invalidRegularExpression() throws IOException {
            PlaceMappingConfiguration config = config(PlaceMappingConfiguration.NON_PLACE_RULES_TABLE,
                    "rules.tsv", "plant\t0.9\t(?<target>萩\n");
            assertThatThrownBy(() -> KnowledgeBaseLoader.load(config)).isInstanceOf(KnowledgeTableException.class)
                    .hasMessageContaining("Invalid regular expression");
        }

        @Test
        void placeCategoryInNonPlaceRules() throws IOException {
            PlaceMappingConfiguration config = config(PlaceMappingConfiguration.NON_PLACE_RULES_TABLE,
                    "rules.tsv", "place\t0.9\t東京\n");
            assertThatThrownBy(() -> KnowledgeBaseLoader.load(config)).isInstanceOf(KnowledgeTableException.class)
                    .hasMessageContaining("not a non-place category");
        }

        @Test
        void wrongNumberOfColumns() throws IOException {
            PlaceMappingConfiguration config = config(PlaceMappingConfiguration.EXTRACTOR_PROFILES_TABLE,
                    "profiles.tsv", "pattern\t1\t0.95\n");
            assertThatThrownBy(() -> KnowledgeBaseLoader.load(config)).isInstanceOf(KnowledgeTableException.class)
                    .hasMessageContaining("columns");
        }

        @Test
        void confidenceOutOfRange() throws IOException {
            PlaceMappingConfiguration config = config(PlaceMappingConfiguration.EXTRACTOR_PROFILES_TABLE,
                    "profiles.tsv", "pattern\t1\t1.5\t0.6\n");
            assertThatThrownBy(() -> KnowledgeBaseLoader.load(config)).isInstanceOf(KnowledgeTableException.class)
                    .hasMessageContaining("Malformed line 1");
        }

        @Test
        void latitudeOutOfRange() throws IOException {
            PlaceMappingConfiguration config = config(PlaceMappingConfiguration.GAZETTEER_PREFIX + "test.table",
                    "gazetteer.tsv", "どこか\t95.0\t10.0\n");
            config.setProperty(PlaceMappingConfiguration.GAZETTEERS, "test");
            assertThatThrownBy(() -> KnowledgeBaseLoader.load(config)).isInstanceOf(KnowledgeTableException.class)
                    .hasMessageContaining("gazetteer test");
        }

        @Test
        void missingSuffixLevel() throws IOException {
            PlaceMappingConfiguration config = config(PlaceMappingConfiguration.SUFFIX_CLASSES_TABLE,
                    "suffixes.tsv", "city\t市\t2\t8\t[一-龯々ヶ]\n");
            assertThatThrownBy(() -> KnowledgeBaseLoader.load(config)).isInstanceOf(KnowledgeTableException.class)
                    .hasMessageContaining("hierarchy levels");
        }

        @Test
        void byteOrderMarkAndCommentsAreSkipped() throws Exception {
            PlaceMappingConfiguration config = config(PlaceMappingConfiguration.REGIONS_TABLE, "regions.txt",
                    "\uFEFF# regions\n千葉県\n\n東京都\n");
            KnowledgeBase kb = KnowledgeBaseLoader.load(config);
            assertThat(kb.getRegions()).containsExactlyInAnyOrder("千葉県", "東京都");
        }
    }
}
