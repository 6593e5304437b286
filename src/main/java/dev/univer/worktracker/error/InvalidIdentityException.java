package dev.univer.worktracker.error;

public class InvalidIdentityException extends RosterException {

    public InvalidIdentityException(String message) {
        super(message);
    }
}
