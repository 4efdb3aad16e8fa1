package com.flowmable.seasonal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The four color buckets of one micro-season.
 */
public record SeasonPalette(
        List<PaletteColor> neutrals,
        List<PaletteColor> accents,
        List<PaletteColor> brights,
        List<PaletteColor> softs
) {
    public SeasonPalette {
        neutrals = List.copyOf(neutrals);
        accents = List.copyOf(accents);
        brights = List.copyOf(brights);
        softs = List.copyOf(softs);
    }

    public List<PaletteColor> colors(ColorGroup group) {
        return switch (group) {
            case NEUTRALS -> neutrals;
            case ACCENTS -> accents;
            case BRIGHTS -> brights;
            case SOFTS -> softs;
        };
    }

    /** Every color of the palette in group order. */
    public List<PaletteColor> allColors() {
        List<PaletteColor> all = new ArrayList<>(neutrals.size() + accents.size() + brights.size() + softs.size());
        for (ColorGroup group : ColorGroup.values()) {
            all.addAll(colors(group));
        }
        return Collections.unmodifiableList(all);
    }
}
