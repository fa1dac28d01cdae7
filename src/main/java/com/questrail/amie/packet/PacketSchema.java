package com.questrail.amie.packet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * PacketSchema
 * ============================================================================
 * Static declaration of one AMIE packet type.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>The type identifier used on the wire (e.g. {@code request_project_create})</li>
 *   <li>Ordered required field names</li>
 *   <li>Ordered allowed (optional) field names, disjoint from the required ones</li>
 *   <li>Ordered identifiers of the packet types permitted as replies</li>
 * </ul>
 *
 * <h2>Accessor generation</h2>
 * <p>
 * Building a schema generates one {@link FieldAccessor} per declared name:
 * a {@link RequiredFieldAccessor} for each required name and an
 * {@link AllowedFieldAccessor} for each allowed name. Adding a packet type
 * therefore only requires declaring its name lists; no per-type accessor code
 * is written by hand.
 * </p>
 *
 * <p>
 * Instances are immutable and safe to share between threads.
 * </p>
 */
public final class PacketSchema
{
    private final String type;
    private final List<String> requiredFields;
    private final List<String> allowedFields;
    private final List<String> expectedReplies;
    private final Map<String, FieldAccessor> accessors;

    private PacketSchema(Builder builder) {
        this.type = builder.type;
        this.requiredFields = List.copyOf(builder.required);
        this.allowedFields = List.copyOf(builder.allowed);
        this.expectedReplies = List.copyOf(builder.replies);

        Map<String, FieldAccessor> generated = new LinkedHashMap<>();
        for (String name : requiredFields) {
            generated.put(name, new RequiredFieldAccessor(this, name));
        }
        for (String name : allowedFields) {
            generated.put(name, new AllowedFieldAccessor(this, name));
        }
        this.accessors = Collections.unmodifiableMap(generated);
    }

    public static Builder builder(String type) {
        return new Builder(type);
    }

    /**
     * Returns the packet type identifier.
     */
    public String type() {
        return type;
    }

    public List<String> requiredFields() {
        return requiredFields;
    }

    public List<String> allowedFields() {
        return allowedFields;
    }

    /**
     * Returns the identifiers of the packet types permitted as a reply, in
     * declaration order. Empty if this packet type expects no reply.
     */
    public List<String> expectedReplies() {
        return expectedReplies;
    }

    public boolean isRequired(String name) {
        return accessors.get(name) instanceof RequiredFieldAccessor;
    }

    public boolean isAllowed(String name) {
        return accessors.get(name) instanceof AllowedFieldAccessor;
    }

    /**
     * Returns {@code true} if the name is declared as required or allowed.
     */
    public boolean declares(String name) {
        return accessors.containsKey(name);
    }

    /**
     * Returns every generated accessor, required fields first, in declaration order.
     */
    public Map<String, FieldAccessor> accessors() {
        return accessors;
    }

    /**
     * Returns the accessor for a declared field.
     *
     * @throws IllegalArgumentException if the name is not declared by this schema
     */
    public FieldAccessor accessor(String name) {
        FieldAccessor accessor = accessors.get(name);
        if (accessor == null) {
            throw new IllegalArgumentException(
                    "Packet type '" + type + "' declares no field '" + name + "'");
        }
        return accessor;
    }

    /**
     * Returns the accessor for a required field.
     *
     * @throws IllegalArgumentException if the name is not a required field of this schema
     */
    public RequiredFieldAccessor required(String name) {
        if (accessor(name) instanceof RequiredFieldAccessor required) {
            return required;
        }
        throw new IllegalArgumentException(
                "Field '" + name + "' of packet type '" + type + "' is not required");
    }

    /**
     * Returns the accessor for an allowed field.
     *
     * @throws IllegalArgumentException if the name is not an allowed field of this schema
     */
    public AllowedFieldAccessor allowed(String name) {
        if (accessor(name) instanceof AllowedFieldAccessor allowed) {
            return allowed;
        }
        throw new IllegalArgumentException(
                "Field '" + name + "' of packet type '" + type + "' is not an allowed field");
    }

    @Override
    public String toString() {
        return "PacketSchema[" + type
                + ", required=" + requiredFields
                + ", allowed=" + allowedFields
                + ", expectedReplies=" + expectedReplies + "]";
    }

    public static final class Builder {
        private final String type;
        private final List<String> required = new ArrayList<>();
        private final List<String> allowed = new ArrayList<>();
        private final List<String> replies = new ArrayList<>();

        private Builder(String type) {
            Objects.requireNonNull(type, "type");
            if (type.isBlank()) {
                throw new IllegalArgumentException("Packet type identifier must not be blank");
            }
            this.type = type;
        }

        public Builder required(String... names) {
            required.addAll(Arrays.asList(names));
            return this;
        }

        public Builder allowed(String... names) {
            allowed.addAll(Arrays.asList(names));
            return this;
        }

        public Builder expectedReplies(String... types) {
            replies.addAll(Arrays.asList(types));
            return this;
        }

        public PacketSchema build() {
            Set<String> seen = new LinkedHashSet<>();
            for (String name : required) {
                checkName(name, seen);
            }
            for (String name : allowed) {
                checkName(name, seen);
            }

            Set<String> replyTypes = new LinkedHashSet<>();
            for (String reply : replies) {
                Objects.requireNonNull(reply, "expected reply type");
                if (!replyTypes.add(reply)) {
                    throw new IllegalArgumentException(
                            "Duplicate expected reply '" + reply + "' for packet type '" + type + "'");
                }
            }
            return new PacketSchema(this);
        }

        private void checkName(String name, Set<String> seen) {
            Objects.requireNonNull(name, "field name");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Blank field name in packet type '" + type + "'");
            }
            if (!seen.add(name)) {
                throw new IllegalArgumentException(
                        "Field '" + name + "' declared twice in packet type '" + type + "'");
            }
        }
    }
}
