package com.healthgate.health;

/**
 * Thrown when a check is registered under a name that is already taken.
 * The earlier registration is left untouched.
 */
public class DuplicateCheckNameException extends IllegalArgumentException {

    private final String checkName;

    public DuplicateCheckNameException(String checkName) {
        super("a health check named '" + checkName + "' is already registered");
        this.checkName = checkName;
    }

    public String checkName() {
        return checkName;
    }
}
