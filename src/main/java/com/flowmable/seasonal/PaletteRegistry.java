package com.flowmable.seasonal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Immutable registry of the micro-season palettes with precomputed Lab values.
 * <p>
 * Every hex literal is converted exactly once, at construction. A literal that does not
 * parse is a configuration defect and fails construction with
 * {@link PaletteConfigurationException}. No mutation API exists afterwards, so a registry
 * can be shared by any number of threads.
 */
public final class PaletteRegistry {

    private static final Logger logger = LoggerFactory.getLogger(PaletteRegistry.class);

    public static final String DEFAULT_RESOURCE = "palettes/micro-seasons.json";

    private final Map<MicroSeason, SeasonPalette> palettes;
    private final List<PaletteEntry> entries;

    private PaletteRegistry(Map<MicroSeason, SeasonPalette> palettes) {
        this.palettes = Collections.unmodifiableMap(palettes);

        List<PaletteEntry> all = new ArrayList<>();
        for (MicroSeason microSeason : MicroSeason.values()) {
            SeasonPalette palette = palettes.get(microSeason);
            if (palette == null) {
                continue;
            }
            for (ColorGroup group : ColorGroup.values()) {
                for (PaletteColor color : palette.colors(group)) {
                    all.add(new PaletteEntry(microSeason, group, color));
                }
            }
        }
        this.entries = List.copyOf(all);
    }

    /**
     * The process-wide registry built from {@link #DEFAULT_RESOURCE} on first use.
     */
    public static PaletteRegistry defaultRegistry() {
        return DefaultHolder.INSTANCE;
    }

    /**
     * Build a registry from a classpath JSON resource of the form
     * {@code {"light_spring": {"neutrals": [{"name": "...", "hex": "#..."}], ...}, ...}}.
     * All twelve micro-seasons and all four groups must be present and non-empty.
     *
     * @throws PaletteConfigurationException if the resource is missing or invalid
     */
    public static PaletteRegistry fromClasspath(String resourcePath) {
        Map<String, Map<String, List<Swatch>>> raw = readResource(resourcePath);

        Builder builder = builder();
        for (Map.Entry<String, Map<String, List<Swatch>>> seasonEntry : raw.entrySet()) {
            MicroSeason microSeason = parseKey(resourcePath, seasonEntry.getKey(), MicroSeason::from);
            Map<String, List<Swatch>> groups = seasonEntry.getValue();
            if (groups == null) {
                throw configurationError(resourcePath + ": micro-season '" + seasonEntry.getKey() + "' has no groups");
            }
            for (Map.Entry<String, List<Swatch>> groupEntry : groups.entrySet()) {
                ColorGroup group = parseKey(resourcePath, groupEntry.getKey(), ColorGroup::from);
                List<Swatch> swatches = groupEntry.getValue() == null ? List.of() : groupEntry.getValue();
                for (Swatch swatch : swatches) {
                    if (swatch == null) {
                        throw configurationError(resourcePath + ": null entry in "
                                + microSeason.getTag() + "/" + group.getTag());
                    }
                    builder.add(microSeason, group, swatch.name(), swatch.hex());
                }
            }
        }

        PaletteRegistry registry = builder.build();
        registry.requireComplete(resourcePath);
        logger.info("Palette registry loaded from '{}': {} colors across {} micro-seasons.",
                resourcePath, registry.size(), registry.palettes.size());
        return registry;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the palette of the micro-season, or null if this registry has none for it
     */
    public SeasonPalette getMicroSeasonPalette(MicroSeason microSeason) {
        return palettes.get(microSeason);
    }

    /**
     * Micro-seasons of the given parent season that this registry holds, in scan order.
     */
    public List<MicroSeason> getMicroSeasonsForParent(ParentSeason parent) {
        List<MicroSeason> result = new ArrayList<>(3);
        for (MicroSeason microSeason : MicroSeason.values()) {
            if (microSeason.parent() == parent && palettes.containsKey(microSeason)) {
                result.add(microSeason);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Every {@code (microSeason, group, color)} triple, ordered by micro-season declaration
     * order, then group order, then data order.
     */
    public List<PaletteEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    private void requireComplete(String source) {
        for (MicroSeason microSeason : MicroSeason.values()) {
            SeasonPalette palette = palettes.get(microSeason);
            if (palette == null) {
                throw configurationError(source + ": micro-season '" + microSeason.getTag() + "' is missing");
            }
            for (ColorGroup group : ColorGroup.values()) {
                if (palette.colors(group).isEmpty()) {
                    throw configurationError(source + ": group '" + group.getTag()
                            + "' of '" + microSeason.getTag() + "' is empty");
                }
            }
        }
    }

    private static Map<String, Map<String, List<Swatch>>> readResource(String resourcePath) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = PaletteRegistry.class.getClassLoader();
        }
        try (InputStream stream = loader.getResourceAsStream(resourcePath)) {
            if (stream == null) {
                throw configurationError("Palette resource '" + resourcePath + "' not found on classpath");
            }
            Map<String, Map<String, List<Swatch>>> raw = new ObjectMapper().readValue(stream,
                    new TypeReference<LinkedHashMap<String, Map<String, List<Swatch>>>>() {});
            if (raw == null) {
                throw configurationError("Palette resource '" + resourcePath + "' is empty");
            }
            return raw;
        } catch (IOException ex) {
            logger.error("Failed to read palette resource '{}'.", resourcePath, ex);
            throw new PaletteConfigurationException("Unreadable palette resource '" + resourcePath + "'", ex);
        }
    }

    private static <T> T parseKey(String source, String key, Function<String, T> parser) {
        try {
            T value = parser.apply(key);
            if (value == null) {
                throw configurationError(source + ": blank key");
            }
            return value;
        } catch (IllegalArgumentException ex) {
            logger.error("{}: unknown palette key '{}'.", source, key);
            throw new PaletteConfigurationException(source + ": " + ex.getMessage(), ex);
        }
    }

    private static PaletteConfigurationException configurationError(String message) {
        logger.error(message);
        return new PaletteConfigurationException(message);
    }

    /** JSON shape of one palette entry. */
    record Swatch(String name, String hex) {}

    private static final class DefaultHolder {
        private static final PaletteRegistry INSTANCE = fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Collects {@code (microSeason, group, name, hex)} rows and converts them all to Lab in
     * {@link #build()}. Rows keep insertion order within their group.
     */
    public static final class Builder {
        private final Map<MicroSeason, Map<ColorGroup, List<Swatch>>> rows = new EnumMap<>(MicroSeason.class);

        private Builder() {
        }

        public Builder add(MicroSeason microSeason, ColorGroup group, String name, String hex) {
            Objects.requireNonNull(microSeason, "microSeason");
            Objects.requireNonNull(group, "group");
            rows.computeIfAbsent(microSeason, key -> new EnumMap<>(ColorGroup.class))
                    .computeIfAbsent(group, key -> new ArrayList<>())
                    .add(new Swatch(name, hex));
            return this;
        }

        /**
         * @throws PaletteConfigurationException if any name is blank or any hex is malformed
         */
        public PaletteRegistry build() {
            Map<MicroSeason, SeasonPalette> palettes = new EnumMap<>(MicroSeason.class);
            for (Map.Entry<MicroSeason, Map<ColorGroup, List<Swatch>>> seasonRows : rows.entrySet()) {
                MicroSeason microSeason = seasonRows.getKey();
                Map<ColorGroup, List<PaletteColor>> converted = new EnumMap<>(ColorGroup.class);
                for (ColorGroup group : ColorGroup.values()) {
                    List<Swatch> swatches = seasonRows.getValue().getOrDefault(group, List.of());
                    List<PaletteColor> colors = new ArrayList<>(swatches.size());
                    for (Swatch swatch : swatches) {
                        colors.add(toPaletteColor(microSeason, group, swatch));
                    }
                    converted.put(group, colors);
                }
                palettes.put(microSeason, new SeasonPalette(
                        converted.get(ColorGroup.NEUTRALS),
                        converted.get(ColorGroup.ACCENTS),
                        converted.get(ColorGroup.BRIGHTS),
                        converted.get(ColorGroup.SOFTS)));
            }
            return new PaletteRegistry(palettes);
        }

        private static PaletteColor toPaletteColor(MicroSeason microSeason, ColorGroup group, Swatch swatch) {
            String where = microSeason.getTag() + "/" + group.getTag();
            if (swatch == null || swatch.name() == null || swatch.name().isBlank()) {
                throw configurationError("Palette color without a name in " + where);
            }
            Lab lab = ColorSpaceUtils.hexToLab(swatch.hex());
            if (lab == null) {
                throw configurationError("Failed to compute Lab for " + swatch.name()
                        + " (" + swatch.hex() + ") in " + where);
            }
            return new PaletteColor(swatch.name(), swatch.hex(), lab);
        }
    }
}
