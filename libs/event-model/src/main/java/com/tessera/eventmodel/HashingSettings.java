package com.tessera.eventmodel;

/**
 * Settings for event content hashing.
 *
 * <p>The salt is mixed into every event digest, so events hashed under different salts never
 * compare equal. Resolution order for {@link #fromEnvironment()}:
 *
 * <ol>
 *   <li>system property {@value #SALT_PROPERTY}
 *   <li>environment variable {@value #SALT_ENV}
 *   <li>empty salt
 * </ol>
 *
 * @param salt shared secret appended to the canonical encoding before hashing (never null)
 */
public record HashingSettings(String salt) {

    /** System property holding the hashing salt. */
    public static final String SALT_PROPERTY = "tessera.hashing.salt";

    /** Environment variable holding the hashing salt. */
    public static final String SALT_ENV = "SALT_FOR_DATA_INTEGRITY";

    public HashingSettings {
        if (salt == null) {
            salt = "";
        }
    }

    /** Settings with an empty salt. */
    public static HashingSettings unsalted() {
        return new HashingSettings("");
    }

    /** Reads the salt from the system property, then the environment. */
    public static HashingSettings fromEnvironment() {
        String salt = System.getProperty(SALT_PROPERTY);
        if (salt == null) {
            salt = System.getenv(SALT_ENV);
        }
        return new HashingSettings(salt);
    }
}
