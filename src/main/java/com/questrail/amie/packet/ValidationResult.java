package com.questrail.amie.packet;

import java.util.Objects;

/**
 * Outcome of {@link Packet#check()}.
 */
public sealed interface ValidationResult permits ValidationResult.Valid, ValidationResult.Invalid
{
    static ValidationResult valid() {
        return Valid.INSTANCE;
    }

    static ValidationResult missing(String field) {
        return new Invalid(field, "Missing required data field: \"" + field + "\"");
    }

    default boolean isValid() {
        return this instanceof Valid;
    }

    /**
     * Converts this result into the exception {@link Packet#validate()} raises.
     */
    default void orThrow() {
        if (this instanceof Invalid invalid) {
            throw new PacketInvalidDataException(invalid.field(), invalid.message());
        }
    }

    final class Valid implements ValidationResult {
        static final Valid INSTANCE = new Valid();

        private Valid() {
        }

        @Override
        public String toString() {
            return "ValidationResult.Valid";
        }
    }

    /**
     * @param field   name of the offending field
     * @param message human-readable description
     */
    record Invalid(String field, String message) implements ValidationResult {
        public Invalid {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(message, "message");
        }
    }
}
