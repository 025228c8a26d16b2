package meilikeys.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Fingerprints secret key values so they can appear in logs and string forms.
 *
 * <p>A fingerprint is the first 16 hex characters of the SHA-256 digest: stable for the same
 * key, unusable as a credential.
 */
public final class SecureHash {

    private static final int FINGERPRINT_HEX_CHARS = 16;

    private SecureHash() {}

    /**
     * Return the fingerprint of a secret key value.
     *
     * @param secret the key value
     * @return 16 lowercase hex characters, or {@code "none"} when the value is null
     */
    public static String fingerprint(String secret) {
        if (secret == null) {
            return "none";
        }
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            final var hashBytes = digest.digest(secret.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashBytes).substring(0, FINGERPRINT_HEX_CHARS);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 is required on every Java platform", e);
        }
    }
}
