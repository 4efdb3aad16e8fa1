package com.flowmable.seasonal;

import java.util.Objects;

/**
 * A user's coarse color profile as stored by the profile service.
 *
 * @param season      Parent season, required
 * @param depth       Nullable
 * @param clarity     Nullable
 * @param undertone   Nullable; derived from the season when absent
 * @param microSeason Nullable; resolved with {@link SeasonResolver} when absent
 */
public record UserColorProfile(
        ParentSeason season,
        Depth depth,
        Clarity clarity,
        Undertone undertone,
        MicroSeason microSeason
) {
    public UserColorProfile {
        Objects.requireNonNull(season, "season");
    }

    public static UserColorProfile of(ParentSeason season, Depth depth, Clarity clarity) {
        return new UserColorProfile(season, depth, clarity, null, null);
    }

    public Undertone effectiveUndertone() {
        return undertone != null ? undertone : season.expectedUndertone();
    }

    public MicroSeason effectiveMicroSeason() {
        if (microSeason != null) {
            return microSeason;
        }
        return SeasonResolver.determineMicroSeason(season, depth, clarity, effectiveUndertone());
    }
}
