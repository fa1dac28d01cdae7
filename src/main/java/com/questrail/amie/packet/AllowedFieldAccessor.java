package com.questrail.amie.packet;

import java.util.Map;
import java.util.Objects;

/**
 * Accessor for an optional, schema-declared field. Only fields the caller
 * has set are present in the packet's allowed data.
 */
public final class AllowedFieldAccessor implements FieldAccessor
{
    private final PacketSchema schema;
    private final String name;

    AllowedFieldAccessor(PacketSchema schema, String name) {
        this.schema = schema;
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Object get(Packet packet) {
        return allowedData(packet).get(name);
    }

    @Override
    public void set(Packet packet, Object value) {
        Object stored = dateValued() ? DateFields.toTimestamp(name, value) : value;
        allowedData(packet).put(name, stored);
    }

    /**
     * Removes the field from the packet.
     */
    public void clear(Packet packet) {
        allowedData(packet).remove(name);
    }

    private Map<String, Object> allowedData(Packet packet) {
        Objects.requireNonNull(packet, "packet");
        if (packet.schema() != schema) {
            throw new IllegalArgumentException(
                    "Field '" + name + "' belongs to packet type '" + schema.type()
                            + "', not '" + packet.packetType() + "'");
        }
        return packet.allowedData();
    }

    @Override
    public String toString() {
        return "AllowedFieldAccessor[" + schema.type() + "." + name + "]";
    }
}
