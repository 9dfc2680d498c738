package com.dcec.parsing;

/**
 * Raised when input text cannot be tokenized: unbalanced or misplaced
 * parentheses, empty groups, dangling operators.
 */
public class DcecParseException extends RuntimeException {
    private final String input;

    public DcecParseException(String message, String input) {
        super(input == null ? message : message + ": " + input);
        this.input = input;
    }

    /**
     * The text being parsed when the failure happened.
     */
    public String getInput() {
        return input;
    }
}
