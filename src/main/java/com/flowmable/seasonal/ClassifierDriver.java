package com.flowmable.seasonal;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * CLI driver that classifies garment colors and, given a profile, rates them for a user.
 * <p>
 * Usage: {@code ClassifierDriver [--profile <season> [depth] [clarity] [undertone]] <hex>...}
 * <br>
 * Profile attributes are positional; pass {@code -} to leave one unset.
 */
public class ClassifierDriver {

    public static void main(String[] args) {
        List<String> hexes = new ArrayList<>();
        UserColorProfile profile = null;

        int i = 0;
        while (i < args.length) {
            if ("--profile".equals(args[i])) {
                if (i + 1 >= args.length) {
                    printUsage();
                    return;
                }
                String[] fields = new String[4];
                int n = 0;
                i++;
                while (i < args.length && n < fields.length && !looksLikeHex(args[i])) {
                    fields[n++] = "-".equals(args[i]) ? null : args[i];
                    i++;
                }
                try {
                    profile = parseProfile(fields);
                } catch (IllegalArgumentException ex) {
                    System.out.println("Invalid profile: " + ex.getMessage());
                    return;
                }
            } else {
                hexes.add(args[i]);
                i++;
            }
        }

        if (hexes.isEmpty()) {
            printUsage();
            return;
        }

        GarmentClassifier classifier = new GarmentClassifier();
        ClassificationThresholds thresholds = classifier.thresholds();

        System.out.println("===========================================================");
        System.out.println("  SEASONAL PALETTE CLASSIFIER - Garment Report");
        System.out.println("===========================================================");
        System.out.println("Model Version: " + ClassificationThresholds.CLASSIFICATION_MODEL_VERSION);
        System.out.println("Palette colors: " + classifier.registry().size());
        System.out.println("=== Classification Gates ===");
        System.out.println("Unclassified >  " + thresholds.unclassifiedAbove());
        System.out.println("Crossover    <= " + thresholds.crossoverMax());
        System.out.println("Ambiguous gap < " + thresholds.ambiguousGap());
        System.out.println("Great gap    >= " + thresholds.greatGap());
        System.out.println();

        PersonalColorScorer scorer = null;
        if (profile != null) {
            scorer = new PersonalColorScorer(classifier.registry());
            System.out.println("Profile: " + profile.season().getTag()
                    + " → " + profile.effectiveMicroSeason().getTag()
                    + " (undertone " + profile.effectiveUndertone().getTag() + ")");
            System.out.println();
        }

        for (String hex : hexes) {
            ClassificationResult result = classifier.classifyGarment(hex);
            printClassification(result);
            if (scorer != null) {
                printScore(scorer.computeColorScore(hex, profile));
            }
            System.out.println();
        }
    }

    private static void printClassification(ClassificationResult result) {
        System.out.println("── " + result.dominantHex() + " ──");
        if (result.lab() == null) {
            System.out.println("  Not a hex color.");
            return;
        }
        System.out.printf(Locale.ROOT, "  Lab: L=%.2f a=%.2f b=%.2f%n",
                result.lab().l(), result.lab().a(), result.lab().b());
        ClassificationStatus status = result.classificationStatus();
        System.out.println("  Status: " + status.getTag() + (status.isConfident() ? "" : " (low confidence)"));
        if (result.nearestPaletteColor() != null) {
            System.out.printf(Locale.ROOT, "  Nearest: %s %s (ΔE %.2f)%n",
                    result.nearestPaletteColor().name(), result.nearestPaletteColor().hex(), result.minDeltaE());
        }
        if (result.microSeasonTag() != null) {
            System.out.println("  Season: " + result.seasonTag().getTag()
                    + " / " + result.microSeasonTag().getTag()
                    + " / " + result.groupTag().getTag());
        }
        if (result.hasCrossover()) {
            System.out.printf(Locale.ROOT, "  Crossover: %s / %s / %s (ΔE %.2f)%n",
                    result.secondarySeasonTag().getTag(), result.secondaryMicroSeasonTag().getTag(),
                    result.secondaryGroupTag().getTag(), result.secondaryDeltaE());
        }
    }

    private static void printScore(ColorScore score) {
        System.out.println("  Rating: " + score.rating().getTag().toUpperCase(Locale.ROOT));
        System.out.println("  Reason: " + score.ratingReason());
        System.out.println("  " + score.explanation().summary());
        for (ColorExplanation.Bullet bullet : score.explanation().bullets()) {
            System.out.println("    - " + bullet.text());
        }
    }

    private static UserColorProfile parseProfile(String[] fields) {
        ParentSeason season = ParentSeason.from(fields[0]);
        if (season == null) {
            throw new IllegalArgumentException("Parent season is required");
        }
        return new UserColorProfile(season,
                Depth.from(fields[1]),
                Clarity.from(fields[2]),
                Undertone.from(fields[3]),
                null);
    }

    private static boolean looksLikeHex(String arg) {
        return arg.startsWith("#") || ColorSpaceUtils.hexToRgb(arg) != null;
    }

    private static void printUsage() {
        System.out.println("Usage: ClassifierDriver [--profile <season> [depth] [clarity] [undertone]] <hex>...");
        System.out.println("  season:    spring | summer | autumn | winter");
        System.out.println("  depth:     light | medium | deep");
        System.out.println("  clarity:   muted | medium | clear | vivid");
        System.out.println("  undertone: warm | cool | neutral | olive");
        System.out.println("  Use '-' to skip a profile attribute.");
    }
}
