package com.questrail.amie.packet;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Packet
 * ============================================================================
 * One AMIE protocol message instance.
 *
 * <h2>State</h2>
 * <ul>
 *   <li>Identity: packet id (may be assigned after construction) and date</li>
 *   <li>Reply linkage: the id of the packet this one answers, if any</li>
 *   <li>Required data: exactly the schema's required names, values nullable</li>
 *   <li>Allowed data: the schema's optional names the caller has set</li>
 *   <li>Additional data: any field the schema does not declare, kept verbatim</li>
 * </ul>
 *
 * <p>
 * All three field maps are allocated per instance. Schema-declared fields are
 * read and written through the {@link FieldAccessor}s generated by the
 * packet's {@link PacketSchema}, either directly or via the name-checked
 * {@link #get(String)}, {@link #set(String, Object)} and {@link #reset(String)}
 * helpers.
 * </p>
 *
 * <h2>Concrete types</h2>
 * <p>
 * A concrete packet type declares a {@code static final PacketSchema} and a
 * constructor taking a {@link PacketIdentity}. It may add typed getters backed
 * by the schema's accessors and may refine validation through
 * {@link #checkTypeSpecific()}.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * A packet is a single-owner mutable value and is not thread-safe.
 * </p>
 */
public abstract class Packet
{
    private final PacketSchema schema;
    private final Map<String, Object> requiredData;
    private final Map<String, Object> allowedData = new LinkedHashMap<>();
    private final Map<String, Object> additionalData = new LinkedHashMap<>();

    private String packetId;
    private OffsetDateTime date;
    private String inReplyToId;

    protected Packet(PacketSchema schema, PacketIdentity identity) {
        this.schema = Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(identity, "identity");

        this.requiredData = new LinkedHashMap<>();
        for (String name : schema.requiredFields()) {
            requiredData.put(name, null);
        }

        this.packetId = identity.packetId();
        this.date = identity.date();
        this.inReplyToId = linkedId(identity.inReplyTo());
    }

    // ========================================================================
    // Identity
    // ========================================================================

    public final PacketSchema schema() {
        return schema;
    }

    /**
     * Returns the AMIE type identifier of this packet.
     */
    public final String packetType() {
        return schema.type();
    }

    public final List<String> expectedReplies() {
        return schema.expectedReplies();
    }

    public String packetId() {
        return packetId;
    }

    public void setPacketId(String packetId) {
        this.packetId = packetId;
    }

    public OffsetDateTime date() {
        return date;
    }

    public void setDate(OffsetDateTime date) {
        this.date = Objects.requireNonNull(date, "date");
    }

    /**
     * Returns the id of the packet this one answers, or {@code null}.
     */
    public String inReplyToId() {
        return inReplyToId;
    }

    public void setInReplyTo(ReplyTo inReplyTo) {
        this.inReplyToId = linkedId(inReplyTo);
    }

    // An empty id links to nothing.
    private static String linkedId(ReplyTo inReplyTo) {
        String id = inReplyTo == null ? null : inReplyTo.packetId();
        return id == null || id.isEmpty() ? null : id;
    }

    public boolean isReply() {
        return inReplyToId != null;
    }

    // ========================================================================
    // Field access
    // ========================================================================

    /**
     * Returns the value of a schema-declared field.
     *
     * @throws IllegalArgumentException if the schema does not declare {@code name}
     */
    public Object get(String name) {
        return schema.accessor(name).get(this);
    }

    /**
     * Sets the value of a schema-declared field.
     *
     * @throws IllegalArgumentException if the schema does not declare {@code name}
     * @throws PacketInvalidDataException if a date-valued field receives an unparseable value
     */
    public void set(String name, Object value) {
        schema.accessor(name).set(this, value);
    }

    /**
     * Clears a schema-declared field. A required field keeps its key with a
     * {@code null} value; an allowed field is removed.
     */
    public void reset(String name) {
        FieldAccessor accessor = schema.accessor(name);
        if (accessor instanceof RequiredFieldAccessor required) {
            required.reset(this);
        } else {
            ((AllowedFieldAccessor) accessor).clear(this);
        }
    }

    /**
     * Read-only view of the required data, in schema order.
     */
    public Map<String, Object> requiredFields() {
        return Collections.unmodifiableMap(requiredData);
    }

    /**
     * Read-only view of the allowed data that has been set.
     */
    public Map<String, Object> allowedFields() {
        return Collections.unmodifiableMap(allowedData);
    }

    /**
     * Read-only view of fields outside the schema.
     */
    public Map<String, Object> additionalData() {
        return Collections.unmodifiableMap(additionalData);
    }

    /**
     * Stores a field the schema does not declare.
     *
     * @throws IllegalArgumentException if the schema declares {@code name}
     */
    public void putAdditional(String name, Object value) {
        Objects.requireNonNull(name, "name");
        if (schema.declares(name)) {
            throw new IllegalArgumentException(
                    "Field '" + name + "' is declared by packet type '" + packetType()
                            + "'; set it through its accessor");
        }
        additionalData.put(name, value);
    }

    public Object removeAdditional(String name) {
        return additionalData.remove(name);
    }

    /**
     * Routes named values into the packet: schema-declared names go through
     * their accessors, anything else is kept as additional data.
     */
    public void applyFields(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields");
        for (Map.Entry<String, ?> entry : fields.entrySet()) {
            if (schema.declares(entry.getKey())) {
                set(entry.getKey(), entry.getValue());
            } else {
                additionalData.put(entry.getKey(), entry.getValue());
            }
        }
    }

    Map<String, Object> requiredData() {
        return requiredData;
    }

    Map<String, Object> allowedData() {
        return allowedData;
    }

    // ========================================================================
    // Validation
    // ========================================================================

    /**
     * Checks this packet's data.
     *
     * <p>
     * A reply passes the presence check unconditionally: the recipient fills
     * missing required data from the referenced packet. Otherwise the first
     * required field without a value, in schema order, is reported. Type
     * specific rules from {@link #checkTypeSpecific()} run after the presence
     * check passes.
     * </p>
     */
    public final ValidationResult check() {
        if (inReplyToId == null) {
            for (Map.Entry<String, Object> entry : requiredData.entrySet()) {
                if (entry.getValue() == null) {
                    return ValidationResult.missing(entry.getKey());
                }
            }
        }
        return Objects.requireNonNull(checkTypeSpecific(), "checkTypeSpecific()");
    }

    /**
     * Validates this packet.
     *
     * @throws PacketInvalidDataException naming the offending field
     */
    public final void validate() {
        check().orThrow();
    }

    /**
     * Hook for packet types with rules beyond field presence.
     */
    protected ValidationResult checkTypeSpecific() {
        return ValidationResult.valid();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[type=" + packetType()
                + ", packetId=" + packetId
                + ", inReplyTo=" + inReplyToId
                + ", required=" + requiredData
                + ", allowed=" + allowedData
                + ", additional=" + additionalData + "]";
    }
}
