package com.payment.stripe.error;

import jakarta.validation.ConstraintViolation;
import lombok.Value;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An input failed local validation. No request was sent.
 */
public class InvalidInputException extends StripeException {

    private final List<FieldViolation> violations;

    public InvalidInputException(List<FieldViolation> violations) {
        super("Invalid input: " + violations.stream()
                .map(v -> v.getField() + " " + v.getMessage())
                .collect(Collectors.joining(", ")));
        this.violations = List.copyOf(violations);
    }

    public static <T> InvalidInputException of(Set<ConstraintViolation<T>> violations) {
        return new InvalidInputException(violations.stream()
                .map(v -> new FieldViolation(v.getPropertyPath().toString(), v.getMessage()))
                .sorted(Comparator.comparing(FieldViolation::getField).thenComparing(FieldViolation::getMessage))
                .collect(Collectors.toList()));
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }

    @Value
    public static class FieldViolation {
        String field;
        String message;
    }
}
