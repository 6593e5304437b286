package dev.univer.worktracker.error;

import lombok.Getter;

/**
 * A submitted day record was rejected before anything was written.
 * {@code day} is the offending date as submitted, or {@code #index} when the date itself is unusable.
 */
@Getter
public class ValidationFailedException extends RosterException {

    private final String day;
    private final String field;

    public ValidationFailedException(String day, String field, String message) {
        super(message);
        this.day = day;
        this.field = field;
    }
}
