package com.questrail.amie.packet.registry;

import com.questrail.amie.packet.Packet;
import com.questrail.amie.packet.PacketInvalidTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * PacketTypeRegistry
 * ============================================================================
 * Maps AMIE type identifiers to their {@link PacketType}.
 *
 * <h2>Lifecycle</h2>
 * <p>
 * A registry is assembled once through {@link Builder} and is immutable
 * afterwards. The process-wide instance returned by {@link #defaultRegistry()}
 * is built on first use from every {@link PacketCatalog} found on the class
 * path and may be read concurrently without locking.
 * </p>
 *
 * <h2>Consistency checks</h2>
 * <ul>
 *   <li>Each type identifier and each packet class is registered once</li>
 *   <li>Every expected reply declared by a registered schema names a registered type</li>
 * </ul>
 */
public final class PacketTypeRegistry
{
    private static final Logger log = LoggerFactory.getLogger(PacketTypeRegistry.class);

    private final Map<String, PacketType<?>> byName;
    private final Map<Class<?>, PacketType<?>> byClass;

    private PacketTypeRegistry(Map<String, PacketType<?>> byName, Map<Class<?>, PacketType<?>> byClass) {
        this.byName = Collections.unmodifiableMap(byName);
        this.byClass = Collections.unmodifiableMap(byClass);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the process-wide registry built from the {@link PacketCatalog}
     * services visible to this class's loader.
     */
    public static PacketTypeRegistry defaultRegistry() {
        return DefaultHolder.INSTANCE;
    }

    /**
     * Builds a registry from the {@link PacketCatalog} services visible to {@code loader}.
     */
    public static PacketTypeRegistry fromServiceLoader(ClassLoader loader) {
        Builder builder = builder();
        for (PacketCatalog catalog : ServiceLoader.load(PacketCatalog.class, loader)) {
            log.debug("Loading packet catalog {}", catalog.getClass().getName());
            builder.registerAll(catalog.packetTypes());
        }
        return builder.build();
    }

    /**
     * Finds the type registered under an identifier.
     */
    public Optional<PacketType<?>> find(String typeName) {
        return Optional.ofNullable(typeName).map(byName::get);
    }

    /**
     * Resolves a type identifier.
     *
     * @throws PacketInvalidTypeException if no registered type matches
     */
    public PacketType<?> lookup(String typeName) {
        return find(typeName).orElseThrow(() -> PacketInvalidTypeException.unknownType(typeName));
    }

    /**
     * Resolves the registered type of an existing packet from its runtime class.
     *
     * @throws PacketInvalidTypeException if the packet's class is not registered
     */
    public PacketType<?> lookup(Packet packet) {
        Objects.requireNonNull(packet, "packet");
        PacketType<?> type = byClass.get(packet.getClass());
        if (type == null) {
            throw new PacketInvalidTypeException(
                    PacketInvalidTypeException.Reason.UNKNOWN_TYPE,
                    packet.packetType(),
                    "No packet type matches provided '" + packet.packetType()
                            + "' (" + packet.getClass().getName() + ")");
        }
        return type;
    }

    public boolean contains(String typeName) {
        return typeName != null && byName.containsKey(typeName);
    }

    /**
     * Returns every registered type in registration order.
     */
    public List<PacketType<?>> types() {
        return List.copyOf(byName.values());
    }

    public int size() {
        return byName.size();
    }

    @Override
    public String toString() {
        return "PacketTypeRegistry" + byName.keySet();
    }

    public static final class Builder {
        private final List<PacketType<?>> types = new ArrayList<>();

        private Builder() {
        }

        public Builder register(PacketType<?> type) {
            types.add(Objects.requireNonNull(type, "type"));
            return this;
        }

        public Builder registerAll(Iterable<? extends PacketType<?>> packetTypes) {
            for (PacketType<?> type : packetTypes) {
                register(type);
            }
            return this;
        }

        /**
         * @throws IllegalStateException if an identifier or class is registered twice,
         *         or an expected reply names an unregistered type
         */
        public PacketTypeRegistry build() {
            Map<String, PacketType<?>> byName = new LinkedHashMap<>();
            Map<Class<?>, PacketType<?>> byClass = new LinkedHashMap<>();

            for (PacketType<?> type : types) {
                PacketType<?> previous = byName.putIfAbsent(type.name(), type);
                if (previous != null) {
                    throw new IllegalStateException(
                            "Packet type '" + type.name() + "' registered twice ("
                                    + previous.packetClass().getName() + ", "
                                    + type.packetClass().getName() + ")");
                }
                if (byClass.putIfAbsent(type.packetClass(), type) != null) {
                    throw new IllegalStateException(
                            "Packet class " + type.packetClass().getName()
                                    + " registered under more than one type");
                }
            }

            for (PacketType<?> type : byName.values()) {
                for (String reply : type.schema().expectedReplies()) {
                    if (!byName.containsKey(reply)) {
                        throw new IllegalStateException(
                                "Packet type '" + type.name() + "' expects reply '"
                                        + reply + "', which is not registered");
                    }
                }
            }

            log.info("Packet type registry built with {} types", byName.size());
            return new PacketTypeRegistry(byName, byClass);
        }
    }

    private static final class DefaultHolder {
        static final PacketTypeRegistry INSTANCE =
                fromServiceLoader(PacketTypeRegistry.class.getClassLoader());
    }
}
