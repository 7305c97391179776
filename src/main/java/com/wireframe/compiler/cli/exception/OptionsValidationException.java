package com.wireframe.compiler.cli.exception;

import java.util.List;

/**
 * Raised by the compile option validator with every problem found in one pass,
 * so the user can fix all of them before rerunning.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super("Invalid compile options (" + errors.size() + "):" + System.lineSeparator()
                + String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    /** Individual option messages, in the order they were detected. */
    public List<String> getErrors() {
        return errors;
    }
}
