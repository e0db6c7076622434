package com.riskcast.backend.service.cache;

import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Redis-style key globs: {@code *} matches any run of characters, {@code ?} exactly one.
 */
final class GlobPattern {

    private GlobPattern() {
    }

    static Predicate<String> matcher(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString()).asMatchPredicate();
    }
}
