package com.demo.relay.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * Read-only color tables, loaded once at startup from a JSON asset of the form
 * {@code {"auto": ["#rrggbb", ...], "named": {"red": "#ff0000", ...}}}.
 */
@Slf4j
public class ColorPalette {

    private static final Pattern HEX_COLOR = Pattern.compile("#[0-9a-fA-F]{6}");

    private final List<String> autoColors;
    private final Map<String, String> namedColors;

    public ColorPalette(List<String> autoColors, Map<String, String> namedColors) {
        if (autoColors.isEmpty()) {
            throw new IllegalArgumentException("Auto color palette must not be empty");
        }
        this.autoColors = List.copyOf(autoColors);
        this.namedColors = Map.copyOf(namedColors);
    }

    public static ColorPalette load(Resource resource, ObjectMapper objectMapper) {
        try (InputStream in = resource.getInputStream()) {
            PaletteFile file = objectMapper.readValue(in, PaletteFile.class);
            log.info("Loaded color palette from {}: auto={}, named={}",
                    resource.getDescription(), file.auto.size(), file.named.size());
            return new ColorPalette(file.auto, file.named);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not load color palette from " + resource.getDescription(), e);
        }
    }

    /**
     * Resolves a {@code #RRGGBB} literal or a case-insensitive palette name.
     */
    public Optional<String> resolve(String spec) {
        if (spec == null) {
            return Optional.empty();
        }
        String named = namedColors.get(spec.toLowerCase(Locale.ROOT));
        if (named != null) {
            return Optional.of(named);
        }
        if (HEX_COLOR.matcher(spec).matches()) {
            return Optional.of(spec.toLowerCase(Locale.ROOT));
        }
        return Optional.empty();
    }

    public String randomAutoColor(Random random) {
        return autoColors.get(random.nextInt(autoColors.size()));
    }

    int namedCount() {
        return namedColors.size();
    }

    static class PaletteFile {
        public List<String> auto = List.of();
        public Map<String, String> named = Map.of();
    }
}
