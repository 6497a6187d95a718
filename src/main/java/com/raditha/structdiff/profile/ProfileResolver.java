package com.raditha.structdiff.profile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps a compilation profile to the preprocessor symbols active under it.
 * <p>
 * {@code javaN} activates {@code JAVA_N} and {@code JAVA_K_OR_LATER} for every K from 1 to N.
 * Custom profiles declared in configuration take precedence over the built-in ones.
 * Instances are immutable and safe to share between threads.
 */
public class ProfileResolver {

    private final Map<String, Set<String>> customProfiles;

    public ProfileResolver() {
        this(Map.of());
    }

    /**
     * @param customProfiles profile name to symbol list; names are matched case-insensitively
     */
    public ProfileResolver(Map<String, ? extends Iterable<String>> customProfiles) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        customProfiles.forEach((name, symbols) -> {
            Set<String> set = new LinkedHashSet<>();
            symbols.forEach(set::add);
            copy.put(name.trim().toLowerCase(Locale.ROOT), Collections.unmodifiableSet(set));
        });
        this.customProfiles = Collections.unmodifiableMap(copy);
    }

    /**
     * Symbols active under the given profile.
     *
     * @throws ProfileResolutionException if the profile is unknown
     */
    public Set<String> resolve(String profile) {
        String normalized = ProfileParser.parseSingle(profile, customProfiles);
        Set<String> custom = customProfiles.get(normalized);
        if (custom != null) {
            return custom;
        }
        int release = ProfileParser.releaseOf(normalized)
                .orElseThrow(() -> new ProfileResolutionException(profile));
        return symbolsForRelease(release);
    }

    /**
     * Normalize and validate a list of profiles before any work starts.
     *
     * @throws ProfileResolutionException listing every invalid entry
     */
    public List<String> normalize(List<String> profiles) {
        return ProfileParser.normalizeAll(profiles, customProfiles);
    }

    /**
     * Symbols used when no profile is requested: those of the newest supported release.
     */
    public Set<String> defaultSymbols() {
        return symbolsForRelease(ProfileParser.MAX_RELEASE);
    }

    public Map<String, Set<String>> getCustomProfiles() {
        return customProfiles;
    }

    static Set<String> symbolsForRelease(int release) {
        Set<String> symbols = new LinkedHashSet<>();
        symbols.add("JAVA_" + release);
        for (int k = ProfileParser.MIN_RELEASE; k <= release; k++) {
            symbols.add("JAVA_" + k + "_OR_LATER");
        }
        return Collections.unmodifiableSet(symbols);
    }
}
