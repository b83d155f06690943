package dev.catananti.passwordlab.util;

import java.util.Random;

/**
 * Symbol pools drawn from when generating or extending passwords.
 * Every pool member classifies into the class the pool is named after.
 */
public final class CharacterPools {

    public static final String LOWERCASE = "abcdefghijklmnopqrstuvwxyz";
    public static final String UPPERCASE = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    public static final String DIGITS = "0123456789";
    public static final String SPECIAL = "!@#$%^&*()_+-=[]{}|;:,.<>?";
    public static final String ALL = LOWERCASE + UPPERCASE + DIGITS + SPECIAL;

    private CharacterPools() {
    }

    public static char pick(String pool, Random random) {
        return pool.charAt(random.nextInt(pool.length()));
    }
}
