package com.flowmable.seasonal;

import java.util.List;

import static com.flowmable.seasonal.ColorExplanation.note;
import static com.flowmable.seasonal.ColorExplanation.plain;

/**
 * Builds the user-facing copy for a personalized rating.
 */
final class ExplanationBuilder {

    private ExplanationBuilder() {}

    static ColorExplanation build(ColorRating rating,
                                  ParentSeason userSeason,
                                  AttributeCompatibility compatibility,
                                  ClarityContext clarity) {
        return switch (rating) {
            case GREAT -> great();
            case GOOD -> good(clarity);
            case OK -> ok(clarity);
            case RISKY -> risky(userSeason, compatibility, clarity);
            case INSUFFICIENT_DATA -> throw new IllegalArgumentException("No explanation for " + rating);
        };
    }

    private static ColorExplanation great() {
        return new ColorExplanation(
                "This color matches your undertone and clarity very well.",
                List.of(
                        plain("It brightens your features and blends naturally with your own coloring."),
                        note("The warmth and softness align with your natural coloring, so it won't create shadows or wash you out."),
                        note("Especially flattering near your face: perfect for tops, scarves, or accessories.")));
    }

    private static ColorExplanation good(ClarityContext clarity) {
        if (clarity.vividWarning() && clarity.tooVividForUser()) {
            return new ColorExplanation(
                    "This color works for you, but it's bold.",
                    List.of(
                            plain("The saturation is higher than your natural coloring prefers."),
                            note("Works well as a statement piece or in small doses."),
                            note("Balance with softer colors from your palette near the face, or use it as an accent.")));
        }
        if (clarity.tooSoftForUser()) {
            return new ColorExplanation(
                    "This color is close to your palette but softer than ideal.",
                    List.of(
                            plain("It may look slightly muted against your vibrant coloring."),
                            note("You'll still look good wearing it."),
                            note("Add brighter accessories or makeup to keep your natural vibrancy.")));
        }
        return new ColorExplanation(
                "This color is close to your palette.",
                List.of(
                        plain("It works well overall, but is slightly off in clarity or depth."),
                        note("You'll still look good wearing it near the face."),
                        note("Works best as a top with an open neckline or layered with a color from your season.")));
    }

    private static ColorExplanation ok(ClarityContext clarity) {
        if (clarity.clarityCap() != null && clarity.tooVividForUser()) {
            String intensity = switch (clarity.chromaLevel()) {
                case NEON -> "very intense";
                case VERY_VIVID -> "quite saturated";
                default -> "bold";
            };
            return new ColorExplanation(
                    "This color is " + intensity + " for your muted coloring.",
                    List.of(
                            plain("High saturation can overpower your natural softness."),
                            note("May create visual competition near your face."),
                            note("Best worn away from the face (pants, skirt, bag) or as a small accent.")));
        }
        if (clarity.tooSoftForUser()) {
            return new ColorExplanation(
                    "This color may look washed out on you.",
                    List.of(
                            plain("The muted tone doesn't match your natural vibrancy."),
                            note("Can make you look less energetic."),
                            note("Best for layering under brighter pieces or worn away from the face.")));
        }
        return new ColorExplanation(
                "Not a perfect match, but wearable.",
                List.of(
                        plain("It may create mild shadowing or reduce brightness."),
                        note("Better with styling: open neckline, layers, makeup, accessories."),
                        note("Best worn away from the face (pants, skirt) or layered with a color from your palette.")));
    }

    private static ColorExplanation risky(ParentSeason userSeason,
                                          AttributeCompatibility compatibility,
                                          ClarityContext clarity) {
        boolean neonForMutedUser = clarity.tooVividForUser() && clarity.chromaLevel() == ChromaLevel.NEON;

        if (compatibility != null && compatibility.hasTrueConflict()) {
            String undertone = userSeason.expectedUndertone() == Undertone.WARM ? "warm" : "cool";
            return new ColorExplanation(
                    "This color conflicts strongly with your " + undertone + " undertone.",
                    List.of(
                            plain("The undertone clashes strongly with your skin's natural coloring."),
                            note("The undertone mismatch can make skin look tired, grey, or sallow."),
                            note("Best avoided near the face. If wearing, keep it far from your face (pants, skirt, shoes).")));
        }
        if (neonForMutedUser) {
            return new ColorExplanation(
                    "This color is too intense for your muted coloring.",
                    List.of(
                            plain("This intensity level can overpower your natural softness."),
                            note("Very saturated colors can make you look washed out or create visual competition."),
                            note("Best as a small accent only. Avoid wearing it as a top or near your face.")));
        }
        String issue = compatibility != null && compatibility.hasClarityMismatch()
                ? "conflicts with your clarity"
                : "is far from your palette";
        return new ColorExplanation(
                "This color " + issue + ".",
                List.of(
                        plain("It may create dullness, greyness, or heavy contrast near the face."),
                        note("The mismatch can emphasize shadows and reduce brightness."),
                        note("If you still want to wear it, keep it away from the face or add a layer in your season's colors near your face.")));
    }
}
