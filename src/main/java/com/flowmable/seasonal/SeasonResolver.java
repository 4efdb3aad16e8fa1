package com.flowmable.seasonal;

import java.util.Objects;

/**
 * Maps a coarse color profile to one of the twelve micro-seasons.
 * <p>
 * Each parent season has its own priority-ordered branch table; the order of the checks is
 * part of the contract. Clarity {@code vivid} is read as {@code clear}.
 */
public final class SeasonResolver {

    private SeasonResolver() {}

    /**
     * @param parentSeason required
     * @param depth        nullable
     * @param clarity      nullable
     * @param undertone    nullable
     */
    public static MicroSeason determineMicroSeason(ParentSeason parentSeason,
                                                   Depth depth,
                                                   Clarity clarity,
                                                   Undertone undertone) {
        Objects.requireNonNull(parentSeason, "parentSeason");
        Clarity normalizedClarity = Clarity.normalize(clarity);

        if (depth == null && normalizedClarity == null) {
            return defaultFor(parentSeason);
        }

        return switch (parentSeason) {
            case SPRING -> resolveSpring(depth, normalizedClarity);
            case SUMMER -> resolveSummer(depth, normalizedClarity);
            case AUTUMN -> resolveAutumn(depth, normalizedClarity);
            case WINTER -> resolveWinter(depth, normalizedClarity, undertone);
        };
    }

    private static MicroSeason resolveSpring(Depth depth, Clarity clarity) {
        if (depth == Depth.LIGHT) {
            return MicroSeason.LIGHT_SPRING;
        }
        if (clarity == Clarity.CLEAR) {
            return MicroSeason.BRIGHT_SPRING;
        }
        return MicroSeason.WARM_SPRING;
    }

    private static MicroSeason resolveSummer(Depth depth, Clarity clarity) {
        if (depth == Depth.LIGHT) {
            return MicroSeason.LIGHT_SUMMER;
        }
        if (clarity == Clarity.MUTED) {
            return MicroSeason.SOFT_SUMMER;
        }
        return MicroSeason.COOL_SUMMER;
    }

    private static MicroSeason resolveAutumn(Depth depth, Clarity clarity) {
        // Muted is checked before depth: a deep, muted autumn is soft.
        if (clarity == Clarity.MUTED) {
            return MicroSeason.SOFT_AUTUMN;
        }
        if (depth == Depth.DEEP) {
            return MicroSeason.DEEP_AUTUMN;
        }
        return MicroSeason.WARM_AUTUMN;
    }

    private static MicroSeason resolveWinter(Depth depth, Clarity clarity, Undertone undertone) {
        // Clear is checked before depth: a deep, clear winter is bright.
        if (clarity == Clarity.CLEAR) {
            return MicroSeason.BRIGHT_WINTER;
        }
        if (undertone == Undertone.COOL && depth == Depth.DEEP) {
            return MicroSeason.DEEP_WINTER;
        }
        return MicroSeason.COOL_WINTER;
    }

    /**
     * String form used by profile storage. Blank values count as absent.
     *
     * @throws IllegalArgumentException for a missing season or an unknown tag
     */
    public static MicroSeason determineMicroSeason(String parentSeason,
                                                   String depth,
                                                   String clarity,
                                                   String undertone) {
        ParentSeason season = ParentSeason.from(parentSeason);
        if (season == null) {
            throw new IllegalArgumentException("Parent season is required");
        }
        return determineMicroSeason(season, Depth.from(depth), Clarity.from(clarity), Undertone.from(undertone));
    }

    /** Micro-season used when neither depth nor clarity is known. */
    public static MicroSeason defaultFor(ParentSeason parentSeason) {
        return switch (parentSeason) {
            case SPRING -> MicroSeason.WARM_SPRING;
            case SUMMER -> MicroSeason.COOL_SUMMER;
            case AUTUMN -> MicroSeason.WARM_AUTUMN;
            case WINTER -> MicroSeason.COOL_WINTER;
        };
    }
}
