package com.flowmable.seasonal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Validates gating, crossover detection and confidence tiers of the garment classifier.
 */
class GarmentClassifierTest {

    private final GarmentClassifier classifier = new GarmentClassifier();

    @Test
    void exactPaletteColor_great() {
        ClassificationResult result = classifier.classifyGarment("#FF6F61");

        assertEquals(ClassificationStatus.GREAT, result.classificationStatus());
        assertEquals(MicroSeason.WARM_SPRING, result.microSeasonTag());
        assertEquals(ParentSeason.SPRING, result.seasonTag());
        assertEquals(ColorGroup.ACCENTS, result.groupTag());
        assertEquals("Coral", result.nearestPaletteColor().name());
        assertEquals(0.0, result.minDeltaE(), 1e-9);
        assertFalse(result.hasCrossover());
    }

    @Test
    void pureWhite_goodWithoutCrossover() {
        // Runner-up "Sharp White" is a different group of the same parent season
        ClassificationResult result = classifier.classifyGarment("#FFFFFF");

        assertEquals(MicroSeason.BRIGHT_WINTER, result.microSeasonTag());
        assertEquals(ColorGroup.NEUTRALS, result.groupTag());
        assertEquals("True White", result.nearestPaletteColor().name());
        assertEquals("#FFFFFF", result.nearestPaletteColor().hex());
        assertEquals(0.0, result.minDeltaE(), 1e-9);
        assertEquals(ClassificationStatus.GOOD, result.classificationStatus());
        assertNull(result.secondaryMicroSeasonTag());
        assertNull(result.secondarySeasonTag());
        assertNull(result.secondaryGroupTag());
        assertNull(result.secondaryDeltaE());
    }

    @Test
    void pureBlack_ambiguous() {
        ClassificationResult result = classifier.classifyGarment("#000");

        assertEquals(MicroSeason.BRIGHT_WINTER, result.microSeasonTag());
        assertEquals("Jet Black", result.nearestPaletteColor().name());
        assertEquals(ClassificationStatus.AMBIGUOUS, result.classificationStatus());
        assertFalse(result.hasCrossover());
        assertEquals("#000", result.dominantHex());
    }

    @Test
    void navy_crossoverToWinter() {
        ClassificationResult result = classifier.classifyGarment("#1E3A8A");

        assertEquals(MicroSeason.BRIGHT_SPRING, result.microSeasonTag());
        assertEquals(ParentSeason.SPRING, result.seasonTag());
        assertEquals(ColorGroup.NEUTRALS, result.groupTag());
        assertEquals("Bright Navy", result.nearestPaletteColor().name());
        assertEquals(1.476, result.minDeltaE(), 0.01);

        assertTrue(result.hasCrossover());
        assertEquals(MicroSeason.DEEP_WINTER, result.secondaryMicroSeasonTag());
        assertEquals(ParentSeason.WINTER, result.secondarySeasonTag());
        assertEquals(ColorGroup.BRIGHTS, result.secondaryGroupTag());
        assertEquals(4.227, result.secondaryDeltaE(), 0.01);
        assertEquals(ClassificationStatus.GOOD, result.classificationStatus());
    }

    @Test
    void farFromEveryPalette_unclassifiedWithDiagnostics() {
        ClassificationResult result = classifier.classifyGarment("#00FF00");

        assertEquals(ClassificationStatus.UNCLASSIFIED, result.classificationStatus());
        assertNull(result.microSeasonTag());
        assertNull(result.seasonTag());
        assertNull(result.groupTag());
        assertFalse(result.hasCrossover());
        assertNotNull(result.lab());
        assertEquals("Light Apple Green", result.nearestPaletteColor().name());
        assertEquals(13.82, result.minDeltaE(), 0.01);
        assertTrue(result.minDeltaE() > ClassificationThresholds.DEFAULT.unclassifiedAbove());
    }

    @Test
    void justInsideGate_classified() {
        ClassificationResult result = classifier.classifyGarment("#7CFC00");

        assertEquals(MicroSeason.BRIGHT_SPRING, result.microSeasonTag());
        assertEquals("Lime", result.nearestPaletteColor().name());
        assertTrue(result.minDeltaE() <= 12.0);
        assertEquals(ClassificationStatus.AMBIGUOUS, result.classificationStatus());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "#", "not-a-color", "#1234", "#GG0000", "#FFFFFFF",
            "#\u0663\u0663\u0663", "\uFF21\uFF22\uFF23", "\uFF26\uFF26\uFF26"})
    void malformedHex_unclassifiedWithoutLab(String hex) {
        ClassificationResult result = classifier.classifyGarment(hex);

        assertEquals(ClassificationStatus.UNCLASSIFIED, result.classificationStatus());
        assertEquals(hex, result.dominantHex());
        assertNull(result.lab());
        assertNull(result.nearestPaletteColor());
        assertNull(result.minDeltaE());
        assertNull(result.microSeasonTag());
    }

    @Test
    void nullHex_unclassified() {
        ClassificationResult result = classifier.classifyGarment(null);
        assertEquals(ClassificationStatus.UNCLASSIFIED, result.classificationStatus());
        assertNull(result.lab());
    }

    @Test
    void inputFormsAreEquivalent() {
        ClassificationResult upper = classifier.classifyGarment("#ABC");
        ClassificationResult lower = classifier.classifyGarment("abc");
        ClassificationResult full = classifier.classifyGarment("#aabbcc");

        assertEquals(upper.microSeasonTag(), lower.microSeasonTag());
        assertEquals(upper.microSeasonTag(), full.microSeasonTag());
        assertEquals(upper.minDeltaE(), full.minDeltaE(), 1e-12);
        assertEquals(MicroSeason.SOFT_SUMMER, full.microSeasonTag());
        assertEquals("Blue Mist", full.nearestPaletteColor().name());
    }

    @Test
    void deterministic() {
        for (String hex : new String[]{"#1E3A8A", "#FFFFFF", "#000000", "#abc", "#00FF00"}) {
            assertEquals(classifier.classifyGarment(hex), classifier.classifyGarment(hex), hex);
        }
    }

    @Test
    void everyPaletteColorClassifiesToItself() {
        PaletteRegistry registry = classifier.registry();
        for (PaletteEntry entry : registry.entries()) {
            ClassificationResult result = classifier.classifyGarment(entry.color().hex());
            assertEquals(0.0, result.minDeltaE(), 1e-9, entry.color().name());
            assertEquals(entry.microSeason(), result.microSeasonTag(), entry.color().name());
            assertEquals(entry.group(), result.groupTag(), entry.color().name());
            assertNotEquals(ClassificationStatus.UNCLASSIFIED, result.classificationStatus());
        }
    }

    @Test
    void closeRunnerUpFromOtherParent_ambiguousCrossover() {
        PaletteRegistry registry = PaletteRegistry.builder()
                .add(MicroSeason.WARM_SPRING, ColorGroup.ACCENTS, "Coral", "#FF6F61")
                .add(MicroSeason.COOL_SUMMER, ColorGroup.ACCENTS, "Rose Coral", "#FF7061")
                .build();
        ClassificationResult result = new GarmentClassifier(registry).classifyGarment("#FF6F61");

        assertEquals(MicroSeason.WARM_SPRING, result.microSeasonTag());
        assertEquals(ClassificationStatus.AMBIGUOUS, result.classificationStatus());
        assertTrue(result.hasCrossover());
        assertEquals(MicroSeason.COOL_SUMMER, result.secondaryMicroSeasonTag());
        assertEquals(ParentSeason.SUMMER, result.secondarySeasonTag());
        assertEquals(ColorGroup.ACCENTS, result.secondaryGroupTag());
        assertTrue(result.secondaryDeltaE() < 2.0);
    }

    @Test
    void closeRunnerUpFromSameParent_noSecondary() {
        PaletteRegistry registry = PaletteRegistry.builder()
                .add(MicroSeason.WARM_SPRING, ColorGroup.ACCENTS, "Coral", "#FF6F61")
                .add(MicroSeason.BRIGHT_SPRING, ColorGroup.BRIGHTS, "Rose Coral", "#FF7061")
                .build();
        ClassificationResult result = new GarmentClassifier(registry).classifyGarment("#FF6F61");

        assertEquals(ClassificationStatus.AMBIGUOUS, result.classificationStatus());
        assertFalse(result.hasCrossover());
        assertNull(result.secondaryDeltaE());
    }

    @Test
    void runnerUpSkipsColorsOfTheSameGroup() {
        // The second coral shares the best match's group, so the runner-up is the far color
        PaletteRegistry registry = PaletteRegistry.builder()
                .add(MicroSeason.WARM_SPRING, ColorGroup.ACCENTS, "Coral", "#FF6F61")
                .add(MicroSeason.WARM_SPRING, ColorGroup.ACCENTS, "Rose Coral", "#FF7061")
                .add(MicroSeason.DEEP_WINTER, ColorGroup.NEUTRALS, "Black", "#000000")
                .build();
        ClassificationResult result = new GarmentClassifier(registry).classifyGarment("#FF6F61");

        assertEquals(ClassificationStatus.GREAT, result.classificationStatus());
        assertFalse(result.hasCrossover());
    }

    @Test
    void singleGroupRegistry_noRunnerUpIsGreat() {
        PaletteRegistry registry = PaletteRegistry.builder()
                .add(MicroSeason.WARM_SPRING, ColorGroup.ACCENTS, "Coral", "#FF6F61")
                .add(MicroSeason.WARM_SPRING, ColorGroup.ACCENTS, "Rose Coral", "#FF7061")
                .build();
        ClassificationResult result = new GarmentClassifier(registry).classifyGarment("#FF6F61");

        assertEquals(ClassificationStatus.GREAT, result.classificationStatus());
        assertEquals("Coral", result.nearestPaletteColor().name());
    }

    @Test
    void exactTie_firstInScanOrderWins() {
        PaletteRegistry registry = PaletteRegistry.builder()
                .add(MicroSeason.DEEP_WINTER, ColorGroup.NEUTRALS, "Winter Black", "#000000")
                .add(MicroSeason.DEEP_AUTUMN, ColorGroup.NEUTRALS, "Autumn Black", "#000000")
                .build();
        ClassificationResult result = new GarmentClassifier(registry).classifyGarment("#000000");

        // DEEP_AUTUMN is declared before DEEP_WINTER
        assertEquals(MicroSeason.DEEP_AUTUMN, result.microSeasonTag());
        assertEquals("Autumn Black", result.nearestPaletteColor().name());
        assertEquals(ClassificationStatus.AMBIGUOUS, result.classificationStatus());
        assertEquals(MicroSeason.DEEP_WINTER, result.secondaryMicroSeasonTag());
        assertEquals(0.0, result.secondaryDeltaE(), 1e-12);
    }

    @Test
    void emptyRegistry_unclassifiedKeepsLab() {
        GarmentClassifier empty = new GarmentClassifier(PaletteRegistry.builder().build());
        ClassificationResult result = empty.classifyGarment("#FF6F61");

        assertEquals(ClassificationStatus.UNCLASSIFIED, result.classificationStatus());
        assertNotNull(result.lab());
        assertNull(result.nearestPaletteColor());
    }

    @Test
    void otherParentRunnerUpJustPastCrossoverLimit_noSecondary() {
        // ΔE(#606060, #7B7B7B) ≈ 10.50, inside the classification gate but past the crossover limit
        PaletteRegistry registry = PaletteRegistry.builder()
                .add(MicroSeason.SOFT_AUTUMN, ColorGroup.NEUTRALS, "Mid Gray", "#7B7B7B")
                .add(MicroSeason.DEEP_WINTER, ColorGroup.NEUTRALS, "Slate", "#606060")
                .build();
        ClassificationResult result = new GarmentClassifier(registry).classifyGarment("#606060");

        assertEquals(MicroSeason.DEEP_WINTER, result.microSeasonTag());
        assertFalse(result.hasCrossover());
        assertNull(result.secondaryMicroSeasonTag());
        assertNull(result.secondaryDeltaE());
        assertEquals(ClassificationStatus.GREAT, result.classificationStatus());
    }

    @Test
    void otherParentRunnerUpJustInsideCrossoverLimit_secondary() {
        // ΔE(#606060, #797979) ≈ 9.68
        PaletteRegistry registry = PaletteRegistry.builder()
                .add(MicroSeason.SOFT_AUTUMN, ColorGroup.NEUTRALS, "Mid Gray", "#797979")
                .add(MicroSeason.DEEP_WINTER, ColorGroup.NEUTRALS, "Slate", "#606060")
                .build();
        ClassificationResult result = new GarmentClassifier(registry).classifyGarment("#606060");

        assertTrue(result.hasCrossover());
        assertEquals(ParentSeason.AUTUMN, result.secondarySeasonTag());
        assertEquals(9.68, result.secondaryDeltaE(), 0.01);
    }

    @Test
    void customCrossoverLimit_aroundRunnerUp() {
        // Navy's runner-up (deep winter "True Blue") sits at ΔE ≈ 4.227
        ClassificationThresholds below = new ClassificationThresholds(12.0, 4.2, 2.0, 4.0);
        ClassificationThresholds above = new ClassificationThresholds(12.0, 4.25, 2.0, 4.0);
        PaletteRegistry registry = PaletteRegistry.defaultRegistry();

        assertFalse(new GarmentClassifier(registry, below).classifyGarment("#1E3A8A").hasCrossover());
        assertTrue(new GarmentClassifier(registry, above).classifyGarment("#1E3A8A").hasCrossover());
    }

    @Test
    void statusForGap_tierEdges() {
        ClassificationThresholds thresholds = ClassificationThresholds.DEFAULT;

        assertEquals(ClassificationStatus.AMBIGUOUS, thresholds.statusForGap(0.0));
        assertEquals(ClassificationStatus.AMBIGUOUS, thresholds.statusForGap(1.999));
        assertEquals(ClassificationStatus.GOOD, thresholds.statusForGap(2.0));
        assertEquals(ClassificationStatus.GOOD, thresholds.statusForGap(3.999));
        assertEquals(ClassificationStatus.GREAT, thresholds.statusForGap(4.0));
        assertEquals(ClassificationStatus.GREAT, thresholds.statusForGap(Double.POSITIVE_INFINITY));
    }

    @Test
    void confidentStatuses() {
        assertTrue(ClassificationStatus.GREAT.isConfident());
        assertTrue(ClassificationStatus.GOOD.isConfident());
        assertFalse(ClassificationStatus.AMBIGUOUS.isConfident());
        assertFalse(ClassificationStatus.UNCLASSIFIED.isConfident());
    }

    @Test
    void customThresholds_tightGate() {
        ClassificationThresholds strict = new ClassificationThresholds(1.0, 10.0, 2.0, 4.0);
        GarmentClassifier strictClassifier = new GarmentClassifier(PaletteRegistry.defaultRegistry(), strict);

        assertEquals(ClassificationStatus.UNCLASSIFIED, strictClassifier.classifyGarment("#1E3A8A").classificationStatus());
        assertEquals(ClassificationStatus.GREAT, strictClassifier.classifyGarment("#FF6F61").classificationStatus());
    }

    @Test
    void serializesWithTags() throws Exception {
        JsonNode json = new ObjectMapper().valueToTree(classifier.classifyGarment("#1E3A8A"));

        assertEquals("bright_spring", json.get("microSeasonTag").asText());
        assertEquals("spring", json.get("seasonTag").asText());
        assertEquals("neutrals", json.get("groupTag").asText());
        assertEquals("winter", json.get("secondarySeasonTag").asText());
        assertEquals("good", json.get("classificationStatus").asText());
        assertThat(json.get("lab").has("L")).isTrue();
    }
}
