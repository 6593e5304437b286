package dev.univer.worktracker.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of places a person can work from on a given day.
 * Each constant carries its wire code, the label the UI shows, and the legacy labels
 * older clients still send.
 */
public enum Location {
    ON_SITE("on-site", "Neal Street", false, "Office"),
    REMOTE("remote", "WFH", false),
    CLIENT_SITE("client-site", "Client Office", true, "Client"),
    LEAVE("leave", "Holiday", false, "Off", "PTO"),
    ABROAD("abroad", "Working From Abroad", false),
    OTHER("other", "Other", true);

    private final String code;
    private final String label;
    private final boolean qualifierRequired;
    private final List<String> aliases;

    Location(String code, String label, boolean qualifierRequired, String... aliases) {
        this.code = code;
        this.label = label;
        this.qualifierRequired = qualifierRequired;
        this.aliases = List.of(aliases);
    }

    @JsonValue
    public String getCode() { return code; }

    public String getLabel() { return label; }

    /** Client-site and other days must name the client / describe the place. */
    public boolean isQualifierRequired() { return qualifierRequired; }

    /**
     * Resolves a code, enum name, UI label or legacy alias. Matching is case-insensitive
     * after trimming.
     */
    public static Optional<Location> fromLabel(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String v = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                     .filter(l -> l.matches(v))
                     .findFirst();
    }

    private boolean matches(String lowered) {
        if (code.equals(lowered) || name().toLowerCase(Locale.ROOT).equals(lowered)) return true;
        if (label.toLowerCase(Locale.ROOT).equals(lowered)) return true;
        return aliases.stream().anyMatch(a -> a.toLowerCase(Locale.ROOT).equals(lowered));
    }
}
