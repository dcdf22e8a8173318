package com.csd.repocleaner.exception;

/**
 * Raised when a rule set cannot be applied, e.g. a version pattern is not a valid regex.
 */
public class InvalidRuleException extends IllegalArgumentException {

    private final String pattern;

    public InvalidRuleException(String pattern, String message, Throwable cause) {
        super(message, cause);
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }
}
