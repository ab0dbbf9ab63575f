package com.schemaid.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Versioned schema fingerprint, rendered as {@code "<version>:<hex digest>"}.
 *
 * Two identifiers are equal only if both version and digest match; identifiers from different
 * versions are never reported equal.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Identifier {

    private static final Pattern VERSION = Pattern.compile("v[0-9]+");
    private static final Pattern DIGEST = Pattern.compile("[0-9a-f]+");

    @NonNull
    String version;

    @NonNull
    String digest;

    public static Identifier of(AlgorithmVersion version, String digest) {
        return create(version.getTag(), digest);
    }

    /**
     * Parses the string form. Unknown versions are accepted so that identifiers from other
     * engine releases can still be compared (as {@link SchemaComparison#INCOMPARABLE}).
     */
    public static Identifier parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Identifier text is null");
        }
        int colon = text.indexOf(':');
        if (colon <= 0 || colon == text.length() - 1) {
            throw new IllegalArgumentException("Identifier must look like '<version>:<hex>': " + text);
        }
        return create(text.substring(0, colon), text.substring(colon + 1));
    }

    private static Identifier create(String version, String digest) {
        if (!VERSION.matcher(version).matches()) {
            throw new IllegalArgumentException("Invalid identifier version: " + version);
        }
        String normalized = digest.toLowerCase(Locale.ROOT);
        if (!DIGEST.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Invalid identifier digest: " + digest);
        }
        return new Identifier(version, normalized);
    }

    public SchemaComparison compare(Identifier other) {
        if (!version.equals(other.version)) {
            return SchemaComparison.INCOMPARABLE;
        }
        return digest.equals(other.digest) ? SchemaComparison.SAME : SchemaComparison.DIFFERENT;
    }

    @Override
    public String toString() {
        return version + ":" + digest;
    }
}
