package com.raditha.structdiff.profile;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and normalizes compilation profile names.
 * <p>
 * Built-in profiles are Java release targets: {@code java17}, {@code jdk17} and the legacy
 * {@code java1.8} spelling all name the same release. Names are case-insensitive and
 * normalized to {@code javaN}. Custom profile names are accepted as declared, lower-cased.
 */
public final class ProfileParser {

    public static final int MIN_RELEASE = 1;
    public static final int MAX_RELEASE = 25;

    private static final Pattern RELEASE = Pattern.compile("(?:java|jdk)(1\\.)?(\\d{1,2})");
    private static final Pattern LIST_SEPARATOR = Pattern.compile("[;,]");

    private ProfileParser() {
    }

    /**
     * Release number of a built-in profile name.
     *
     * @return the release, or empty when the name is not a built-in profile
     */
    public static Optional<Integer> releaseOf(String profile) {
        if (profile == null) {
            return Optional.empty();
        }
        Matcher m = RELEASE.matcher(profile.trim().toLowerCase(Locale.ROOT));
        if (!m.matches()) {
            return Optional.empty();
        }
        int release = Integer.parseInt(m.group(2));
        if (m.group(1) != null && (release < 1 || release > 8)) {
            return Optional.empty();
        }
        if (release < MIN_RELEASE || release > MAX_RELEASE) {
            return Optional.empty();
        }
        return Optional.of(release);
    }

    /**
     * Validate and normalize one profile name.
     *
     * @param profile        the name as written by the caller
     * @param customProfiles custom profiles from configuration, keyed by lower-case name
     * @return the normalized name
     * @throws ProfileResolutionException if the name is blank or unknown
     */
    public static String parseSingle(String profile, Map<String, ? extends Set<String>> customProfiles) {
        if (profile == null || profile.isBlank()) {
            throw new ProfileResolutionException("Profile name must not be blank", List.of(String.valueOf(profile)));
        }
        String normalized = profile.trim().toLowerCase(Locale.ROOT);
        if (customProfiles.containsKey(normalized)) {
            return normalized;
        }
        return releaseOf(normalized)
                .map(release -> "java" + release)
                .orElseThrow(() -> new ProfileResolutionException(profile.trim()));
    }

    public static String parseSingle(String profile) {
        return parseSingle(profile, Map.of());
    }

    /**
     * Parse a list such as {@code "java11;java17"} or {@code "java11, jdk17"}.
     * Every invalid entry is reported in one exception; duplicates are removed keeping
     * the first occurrence.
     *
     * @throws ProfileResolutionException listing all invalid entries
     */
    public static List<String> parseMultiple(String profiles, Map<String, ? extends Set<String>> customProfiles) {
        Objects.requireNonNull(profiles, "profiles");
        List<String> entries = new ArrayList<>();
        for (String part : LIST_SEPARATOR.split(profiles)) {
            if (!part.isBlank()) {
                entries.add(part.trim());
            }
        }
        return normalizeAll(entries, customProfiles);
    }

    public static List<String> parseMultiple(String profiles) {
        return parseMultiple(profiles, Map.of());
    }

    /**
     * Validate and normalize a list of profile names.
     *
     * @throws ProfileResolutionException listing all invalid entries
     */
    public static List<String> normalizeAll(List<String> profiles, Map<String, ? extends Set<String>> customProfiles) {
        Set<String> result = new LinkedHashSet<>();
        List<String> invalid = new ArrayList<>();

        for (String profile : profiles) {
            try {
                result.add(parseSingle(profile, customProfiles));
            } catch (ProfileResolutionException e) {
                invalid.addAll(e.getInvalidProfiles());
            }
        }

        if (!invalid.isEmpty()) {
            throw new ProfileResolutionException(
                    "Unknown compilation profile(s): " + String.join(", ", invalid)
                            + ". Expected javaN or jdkN with N in " + MIN_RELEASE + ".." + MAX_RELEASE,
                    invalid);
        }
        return List.copyOf(result);
    }
}
