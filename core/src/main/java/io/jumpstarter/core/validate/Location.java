package io.jumpstarter.core.validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Structural location inside a questionnaire document: an ordered sequence
 * of field names ({@link String}) and list indices ({@link Integer}).
 *
 * <p>
 * Segments mirror the document's own keys, e.g.
 * {@code [questions, 0, cases, 1, questions, 0, answers, 2, goto]}.
 * Immutable; {@link #append} returns a new location.
 */
public record Location(List<Object> segments) {

    /** The empty location (document root). */
    public static final Location ROOT = new Location(List.of());

    public Location {
        Objects.requireNonNull(segments, "segments must not be null");
        for (Object segment : segments) {
            if (!(segment instanceof String) && !(segment instanceof Integer)) {
                throw new IllegalArgumentException("Location segment must be a String or Integer, got: " + segment);
            }
        }
        segments = Collections.unmodifiableList(new ArrayList<>(segments));
    }

    /** Creates a location from the given segments. */
    public static Location of(Object... segments) {
        return new Location(List.of(segments));
    }

    /** Returns a new location with the given segments appended. */
    public Location append(Object... more) {
        List<Object> next = new ArrayList<>(segments.size() + more.length);
        next.addAll(segments);
        Collections.addAll(next, more);
        return new Location(next);
    }

    /** Returns {@code true} for the document root. */
    public boolean isRoot() {
        return segments.isEmpty();
    }

    /** Dot-joined rendering, e.g. {@code questions.0.answers.1.goto}. */
    @Override
    public String toString() {
        if (segments.isEmpty()) {
            return "<root>";
        }
        return segments.stream().map(String::valueOf).collect(Collectors.joining("."));
    }
}
