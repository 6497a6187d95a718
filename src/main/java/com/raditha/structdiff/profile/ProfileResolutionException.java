package com.raditha.structdiff.profile;

import java.util.List;

/**
 * Thrown when one or more compilation profile names cannot be resolved.
 * Raised before any parsing work starts.
 */
public class ProfileResolutionException extends IllegalArgumentException {

    private final transient List<String> invalidProfiles;

    public ProfileResolutionException(String message, List<String> invalidProfiles) {
        super(message);
        this.invalidProfiles = List.copyOf(invalidProfiles);
    }

    public ProfileResolutionException(String profile) {
        this("Unknown compilation profile: '" + profile + "'", List.of(profile));
    }

    /**
     * The profile names that failed to resolve, in the order they were given.
     */
    public List<String> getInvalidProfiles() {
        return invalidProfiles;
    }
}
