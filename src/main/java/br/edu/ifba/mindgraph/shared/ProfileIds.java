package br.edu.ifba.mindgraph.shared;

import java.util.regex.Pattern;

/**
 * Validation for opaque profile identifiers.
 */
public final class ProfileIds {

    private static final Pattern VALID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private ProfileIds() {
    }

    /**
     * Returns the id unchanged when valid.
     *
     * @throws IllegalArgumentException when null, blank, too long or containing other characters
     */
    public static String requireValid(final String profileId) {
        if (profileId == null || !VALID.matcher(profileId).matches()) {
            throw new IllegalArgumentException(
                "Invalid profile id: expected 1-64 characters of [A-Za-z0-9_-], got '" + profileId + "'");
        }
        return profileId;
    }

    public static boolean isValid(final String profileId) {
        return profileId != null && VALID.matcher(profileId).matches();
    }
}
