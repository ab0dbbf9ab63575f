package com.schemaid.hash;

import com.schemaid.model.AlgorithmVersion;
import com.schemaid.model.CanonicalForm;
import com.schemaid.model.Identifier;
import com.schemaid.model.IdentitySettings;

import java.util.HexFormat;

/**
 * Hashes canonical forms into identifiers. No seed, no salt: equal bytes give equal identifiers
 * in every process.
 */
public class SchemaHasher {

    private final AlgorithmVersion version;
    private final int digestLength;

    public SchemaHasher() {
        this(AlgorithmVersion.current(), IdentitySettings.FULL_DIGEST);
    }

    public SchemaHasher(AlgorithmVersion version, int digestLength) {
        if (digestLength < IdentitySettings.MIN_DIGEST_LENGTH || digestLength > IdentitySettings.FULL_DIGEST) {
            throw new IllegalArgumentException("digestLength out of range: " + digestLength);
        }
        this.version = version;
        this.digestLength = digestLength;
    }

    public Identifier hash(CanonicalForm form) {
        byte[] digest = Digests.newDigest(version.getDigestAlgorithm()).digest(form.getBytes());
        String hex = HexFormat.of().formatHex(digest);
        return Identifier.of(version, hex.substring(0, Math.min(digestLength, hex.length())));
    }
}
