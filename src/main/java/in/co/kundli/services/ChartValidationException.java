package in.co.kundli.services;

import java.util.List;

/**
 * A birth chart request failed validation. Carries every problem found, not just the first.
 */
public class ChartValidationException extends Exception {
    public static final String ERROR_CODE = "VALIDATION_ERROR";

    private final List<String> errors;

    public ChartValidationException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public ChartValidationException(String error) {
        this(List.of(error));
    }

    public List<String> getErrors() {
        return errors;
    }
}
