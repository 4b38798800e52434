package io.jumpstarter.core.validate;

import java.util.Objects;

/**
 * One structural defect found while validating a questionnaire.
 *
 * @param kind     violation kind
 * @param location where in the document the defect sits
 * @param message  human-readable message with the offending value interpolated
 * @param value    the duplicate identifier or the unresolved reference
 */
public record Violation(ViolationKind kind, Location location, String message, String value) {

    public Violation {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(location, "location must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static Violation duplicateId(Location location, String identifier) {
        return new Violation(ViolationKind.DUPLICATE_ID, location, "Duplicate id '" + identifier + "'", identifier);
    }

    public static Violation invalidReference(Location location, String ref) {
        return new Violation(ViolationKind.INVALID_REFERENCE, location, "Unknown reference '" + ref + "'", ref);
    }

    @Override
    public String toString() {
        return location + ": " + message + " [" + kind.code() + "]";
    }
}
