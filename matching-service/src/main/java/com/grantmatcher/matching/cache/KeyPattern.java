package com.grantmatcher.matching.cache;

import java.util.Objects;

/**
 * Glob matcher over cache keys: {@code *} matches any run of characters (including none),
 * {@code ?} matches exactly one, every other character is literal. Matching is case-sensitive.
 *
 * <p>A pattern whose only wildcard is a trailing {@code *} is evaluated as a prefix test.
 */
public final class KeyPattern {

    private final String glob;
    private final String prefix;   // non-null when the pattern is "literal*"

    private KeyPattern(String glob) {
        this.glob = glob;
        int star = glob.indexOf('*');
        boolean prefixOnly = star == glob.length() - 1 && glob.indexOf('?') < 0;
        this.prefix = prefixOnly ? glob.substring(0, star) : null;
    }

    public static KeyPattern compile(String glob) {
        Objects.requireNonNull(glob, "glob");
        if (glob.isBlank()) {
            throw new IllegalArgumentException("Pattern cannot be blank");
        }
        return new KeyPattern(glob);
    }

    public boolean matches(String key) {
        if (key == null) {
            return false;
        }
        if (prefix != null) {
            return key.startsWith(prefix);
        }
        return globMatch(key);
    }

    // Iterative wildcard match with single-star backtracking, linear in practice.
    private boolean globMatch(String key) {
        int k = 0, g = 0;
        int starG = -1, starK = 0;
        while (k < key.length()) {
            if (g < glob.length() && (glob.charAt(g) == '?' || glob.charAt(g) == key.charAt(k))
                    && glob.charAt(g) != '*') {
                k++;
                g++;
            } else if (g < glob.length() && glob.charAt(g) == '*') {
                starG = g++;
                starK = k;
            } else if (starG >= 0) {
                g = starG + 1;
                k = ++starK;
            } else {
                return false;
            }
        }
        while (g < glob.length() && glob.charAt(g) == '*') {
            g++;
        }
        return g == glob.length();
    }

    @Override
    public String toString() {
        return glob;
    }
}
