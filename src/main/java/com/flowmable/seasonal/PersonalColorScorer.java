package com.flowmable.seasonal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Rates how well a garment color suits a particular user.
 * <p>
 * PIPELINE:
 * 1. Search every micro-season of the user's parent season for the closest palette color.
 * 2. Base rating from ΔE (relaxed thresholds for deep garments).
 * 3. True undertone conflict (warm vs cool) forces RISKY; nothing else applies.
 * 4. Clarity caps: bold colors on muted users, soft colors on clear users.
 * 5. Upgrades: near-exact palette match lifts to GOOD, an allowed undertone keeps an
 *    in-range color out of RISKY.
 */
public class PersonalColorScorer {

    private static final Logger logger = LoggerFactory.getLogger(PersonalColorScorer.class);

    private final PaletteRegistry registry;
    private final ScoringThresholds thresholds;

    public PersonalColorScorer() {
        this(PaletteRegistry.defaultRegistry());
    }

    public PersonalColorScorer(PaletteRegistry registry) {
        this(registry, ScoringThresholds.DEFAULT);
    }

    public PersonalColorScorer(PaletteRegistry registry, ScoringThresholds thresholds) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    /**
     * Score a garment worn near the face.
     */
    public ColorScore computeColorScore(String garmentHex, UserColorProfile profile) {
        return computeColorScore(garmentHex, profile, true);
    }

    public ColorScore computeColorScore(String garmentHex, UserColorProfile profile, boolean nearFace) {
        if (garmentHex == null || garmentHex.isBlank() || profile == null) {
            logger.warn("Color score requested without {}", profile == null ? "a profile" : "a color");
            return ColorScore.insufficientData("Need color information to analyze",
                    "Please provide both garment color hex and user season.");
        }

        String normalizedHex = garmentHex.trim();
        if (!normalizedHex.startsWith("#")) {
            normalizedHex = "#" + normalizedHex;
        }
        Lab garmentLab = ColorSpaceUtils.hexToLab(normalizedHex);
        if (garmentLab == null) {
            logger.warn("Invalid color hex code: {}", normalizedHex);
            return ColorScore.insufficientData("Could not analyze color",
                    "Invalid color hex code: " + normalizedHex);
        }

        GarmentAttributes attributes = GarmentAttributes.of(garmentLab);
        ParentSeason userSeason = profile.season();
        Undertone userUndertone = profile.effectiveUndertone();
        MicroSeason userMicroSeason = profile.effectiveMicroSeason();

        // 1. Closest palette color across all sub-seasons of the parent season
        Map<MicroSeason, Double> deltaEBySubSeason = new EnumMap<>(MicroSeason.class);
        double minDistance = Double.POSITIVE_INFINITY;
        PaletteColor closestColor = null;
        ColorGroup closestGroup = null;
        MicroSeason bestSubSeason = null;

        for (MicroSeason subSeason : registry.getMicroSeasonsForParent(userSeason)) {
            SeasonPalette palette = registry.getMicroSeasonPalette(subSeason);
            double minForSubSeason = Double.POSITIVE_INFINITY;
            for (ColorGroup group : ColorGroup.values()) {
                for (PaletteColor color : palette.colors(group)) {
                    double dE = DeltaE2000.deltaE(garmentLab, color.lab());
                    minForSubSeason = Math.min(minForSubSeason, dE);
                    if (dE < minDistance) {
                        minDistance = dE;
                        closestColor = color;
                        closestGroup = group;
                        bestSubSeason = subSeason;
                    }
                }
            }
            deltaEBySubSeason.put(subSeason, minForSubSeason);
        }

        if (closestColor == null) {
            logger.warn("No palette colors available for season '{}'", userSeason.getTag());
            return ColorScore.insufficientData("Could not determine color palette",
                    "No palette colors available for comparison");
        }

        AttributeCompatibility compatibility = AttributeCompatibility.evaluate(
                attributes, userSeason, profile.depth(), profile.clarity());
        boolean undertoneAllowed = AttributeCompatibility.isUndertoneAllowed(attributes.undertone(), userUndertone);

        // Clarity mismatch type
        Clarity userClarity = Clarity.normalize(profile.clarity());
        boolean mutedUser = userClarity == Clarity.MUTED;
        boolean clearUser = userClarity == Clarity.CLEAR;
        boolean garmentVivid = attributes.clarity() == Clarity.CLEAR || attributes.chroma() >= 45;
        boolean garmentMuted = attributes.clarity() == Clarity.MUTED || attributes.chroma() < 20;
        boolean tooVivid = mutedUser && garmentVivid;
        boolean tooSoft = clearUser && garmentMuted;
        ChromaLevel chromaLevel = ChromaLevel.of(attributes.chroma());

        // 2. Base rating
        ColorRating baseRating = thresholds.baseRating(minDistance, garmentLab);
        ColorRating rating = baseRating;
        StringBuilder reason = new StringBuilder(String.format(Locale.ROOT,
                "ΔE %.1f → base: %s", minDistance, baseRating.name()));
        List<String> caps = new ArrayList<>();
        ColorRating clarityCap = null;
        boolean vividWarning = false;

        if (compatibility.hasTrueConflict()) {
            // 3. Hard fail
            rating = ColorRating.RISKY;
            reason = new StringBuilder(String.format(Locale.ROOT, "True undertone conflict (%s↔%s) - HARD FAIL",
                    attributes.undertone().getTag(), userUndertone.getTag()));
            caps.add("undertone_hard_fail");
        } else {
            // 4. Clarity caps
            if (tooVivid) {
                if (chromaLevel == ChromaLevel.NEON && nearFace) {
                    if (rating == ColorRating.GREAT || rating == ColorRating.GOOD) {
                        rating = ColorRating.OK;
                        clarityCap = ColorRating.OK;
                        caps.add("neon_nearface_cap_ok");
                    }
                    vividWarning = true;
                } else if ((chromaLevel == ChromaLevel.VERY_VIVID || chromaLevel == ChromaLevel.VIVID) && nearFace) {
                    if (rating == ColorRating.GREAT) {
                        rating = ColorRating.GOOD;
                        clarityCap = ColorRating.GOOD;
                        caps.add("vivid_nearface_cap_good");
                    }
                    vividWarning = true;
                } else if (rating == ColorRating.GREAT) {
                    rating = ColorRating.GOOD;
                    clarityCap = ColorRating.GOOD;
                    caps.add("clarity_mismatch_cap_good");
                    vividWarning = chromaLevel.isVividOrAbove();
                } else if (chromaLevel.isVividOrAbove()) {
                    vividWarning = true;
                }
            }

            if (tooSoft && rating == ColorRating.GREAT) {
                rating = ColorRating.GOOD;
                clarityCap = ColorRating.GOOD;
                caps.add("too_soft_cap_good");
            }

            // 5. Upgrades
            boolean paletteMatch = minDistance <= thresholds.paletteMatchMax();
            boolean neonNearFace = chromaLevel == ChromaLevel.NEON && nearFace;
            if (undertoneAllowed && paletteMatch && !neonNearFace
                    && (rating == ColorRating.OK || rating == ColorRating.RISKY)) {
                rating = ColorRating.GOOD;
                caps.add("palette_match_upgrade_good");
                reason.append(String.format(Locale.ROOT, " → upgraded to GOOD (palette match ΔE≤%.1f)",
                        thresholds.paletteMatchMax()));
            }

            if (undertoneAllowed && rating == ColorRating.RISKY && minDistance <= thresholds.okMaxFor(garmentLab)) {
                rating = ColorRating.OK;
                caps.add("undertone_protection_ok");
                reason.append(" → protected from RISKY (undertone allowed)");
            }
        }

        if (!caps.isEmpty()) {
            reason.append(" | caps: ").append(caps);
        }

        ClarityContext clarityContext = new ClarityContext(
                clarityCap, vividWarning, chromaLevel, nearFace, tooVivid, tooSoft);
        ColorExplanation explanation = ExplanationBuilder.build(rating, userSeason, compatibility, clarityContext);

        logger.debug("Color score {} for {} ({}): {}", rating.getTag(), normalizedHex,
                userMicroSeason.getTag(), reason);

        return new ColorScore(
                rating,
                baseRating,
                minDistance,
                attributes,
                compatibility,
                clarityContext,
                Collections.unmodifiableList(caps),
                reason.toString(),
                explanation,
                NearestColor.of(closestColor),
                closestGroup,
                bestSubSeason,
                userMicroSeason,
                Collections.unmodifiableMap(deltaEBySubSeason)
        );
    }

    /**
     * Suggested products only show colors rated great or good.
     */
    public boolean passesSuggestedProductsFilter(String garmentHex, UserColorProfile profile) {
        return computeColorScore(garmentHex, profile).rating().isRecommended();
    }
}
