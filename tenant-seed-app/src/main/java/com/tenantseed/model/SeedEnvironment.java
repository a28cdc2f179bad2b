package com.tenantseed.model;

import java.util.Locale;

/**
 * Environment tag applied to every natural-key string so dev and prod fixture sets can
 * share one store without colliding.
 */
public enum SeedEnvironment {

    DEV("DEV"),
    PROD("PROD");

    private final String prefix;

    SeedEnvironment(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    /** "Huan the Great" becomes "[DEV] Huan the Great". */
    public String qualifyName(String baseName) {
        return "[" + prefix + "] " + baseName;
    }

    /** "rivendell" becomes "dev-rivendell". */
    public String qualifySlug(String baseSlug) {
        return selector() + "-" + baseSlug;
    }

    /** "elrond@rivendell.local" becomes "elrond.dev@rivendell.local". */
    public String qualifyEmail(String baseEmail) {
        int at = baseEmail.indexOf('@');
        if (at < 0) {
            throw new IllegalArgumentException("Not an email address: " + baseEmail);
        }
        return baseEmail.substring(0, at) + "." + selector() + baseEmail.substring(at);
    }

    public String selector() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps a CLI or environment-variable selector to an environment. Anything that is not
     * "prod" or "production" selects DEV.
     */
    public static SeedEnvironment fromSelector(String selector) {
        if (selector == null) {
            return DEV;
        }
        String s = selector.trim().toLowerCase(Locale.ROOT);
        return s.equals("prod") || s.equals("production") ? PROD : DEV;
    }
}
