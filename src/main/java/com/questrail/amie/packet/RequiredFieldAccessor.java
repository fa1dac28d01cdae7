package com.questrail.amie.packet;

import java.util.Map;
import java.util.Objects;

/**
 * Accessor for a required field. The key is always present in the packet's
 * required data; {@link #reset(Packet)} writes {@code null} instead of
 * removing it so that validation can still report the field as missing.
 */
public final class RequiredFieldAccessor implements FieldAccessor
{
    private final PacketSchema schema;
    private final String name;

    RequiredFieldAccessor(PacketSchema schema, String name) {
        this.schema = schema;
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Object get(Packet packet) {
        return requiredData(packet).get(name);
    }

    @Override
    public void set(Packet packet, Object value) {
        Object stored = dateValued() ? DateFields.toTimestamp(name, value) : value;
        requiredData(packet).put(name, stored);
    }

    /**
     * Clears the value while keeping the key.
     */
    public void reset(Packet packet) {
        requiredData(packet).put(name, null);
    }

    private Map<String, Object> requiredData(Packet packet) {
        Objects.requireNonNull(packet, "packet");
        if (packet.schema() != schema) {
            throw new IllegalArgumentException(
                    "Field '" + name + "' belongs to packet type '" + schema.type()
                            + "', not '" + packet.packetType() + "'");
        }
        return packet.requiredData();
    }

    @Override
    public String toString() {
        return "RequiredFieldAccessor[" + schema.type() + "." + name + "]";
    }
}
