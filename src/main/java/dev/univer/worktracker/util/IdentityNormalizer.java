package dev.univer.worktracker.util;

import dev.univer.worktracker.error.InvalidIdentityException;

import java.util.Locale;

/**
 * Derives the canonical user key from a typed name: {@code lowercase(trim(name))}, nothing more.
 * Internal whitespace is kept as typed, so "Jo  Smith" and "Jo Smith" are different users.
 */
public final class IdentityNormalizer {

    private IdentityNormalizer() {}

    public static String normalize(String rawName) {
        if (rawName == null) throw new InvalidIdentityException("Name is required");
        String trimmed = rawName.trim();
        if (trimmed.isEmpty()) throw new InvalidIdentityException("Name must not be blank");
        return trimmed.toLowerCase(Locale.ROOT);
    }
}
