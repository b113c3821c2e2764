package com.keer.seating.seating.validation;

import java.util.Optional;

public final class ValidationResult {

    private static final ValidationResult ACCEPTED = new ValidationResult(null);

    private final Rejection rejection;

    private ValidationResult(Rejection rejection) {
        this.rejection = rejection;
    }

    public static ValidationResult accepted() {
        return ACCEPTED;
    }

    public static ValidationResult rejected(Rejection rejection) {
        return new ValidationResult(rejection);
    }

    public boolean isAccepted() {
        return rejection == null;
    }

    public Optional<Rejection> rejection() {
        return Optional.ofNullable(rejection);
    }

    @Override
    public String toString() {
        return isAccepted() ? "Accepted" : "Rejected(" + rejection.describe() + ")";
    }
}
