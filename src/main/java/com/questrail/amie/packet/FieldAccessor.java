package com.questrail.amie.packet;

/**
 * Get/set access to one named field of a packet, generated by a
 * {@link PacketSchema} for every field name it declares.
 *
 * <p>
 * Accessors are bound to the schema that generated them and refuse packets of
 * any other type. Writes to a date-valued field (see {@link DateFields}) are
 * converted to {@link java.time.OffsetDateTime} before they are stored.
 * </p>
 */
public sealed interface FieldAccessor permits RequiredFieldAccessor, AllowedFieldAccessor
{
    /**
     * Returns the field name this accessor is bound to.
     */
    String name();

    /**
     * Returns {@code true} if values are stored as timestamps.
     */
    default boolean dateValued() {
        return DateFields.isDateField(name());
    }

    /**
     * Returns the field's current value, or {@code null} if unset.
     */
    Object get(Packet packet);

    /**
     * Returns the field's current value cast to {@code type}.
     *
     * @throws ClassCastException if the stored value is not a {@code type}
     */
    default <T> T get(Packet packet, Class<T> type) {
        return type.cast(get(packet));
    }

    /**
     * Stores a value for this field.
     *
     * @throws PacketInvalidDataException if a date-valued field receives an unparseable value
     */
    void set(Packet packet, Object value);
}
