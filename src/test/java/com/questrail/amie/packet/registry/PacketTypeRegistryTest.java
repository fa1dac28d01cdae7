package com.questrail.amie.packet.registry;

import com.questrail.amie.packet.Packet;
import com.questrail.amie.packet.PacketIdentity;
import com.questrail.amie.packet.PacketInvalidTypeException;
import com.questrail.amie.packet.PacketSchema;
import com.questrail.amie.packet.fixtures.FixturePacketCatalog;
import com.questrail.amie.packet.fixtures.InformTransactionComplete;
import com.questrail.amie.packet.fixtures.NotifyProjectCreate;
import com.questrail.amie.packet.fixtures.RequestProjectCreate;
import com.questrail.amie.packet.fixtures.UnregisteredPacket;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link PacketTypeRegistry} and {@link PacketType}.
 */
final class PacketTypeRegistryTest
{
    private final PacketTypeRegistry registry = PacketTypeRegistry.defaultRegistry();

    @Test
    void defaultRegistryContainsEveryCatalogedType()
    {
        assertEquals(FixturePacketCatalog.TYPES, registry.types());
    }

    @Test
    void everyRegisteredTypeResolvesByItsOwnIdentifier()
    {
        for (PacketType<?> type : registry.types()) {
            assertSame(type, registry.lookup(type.schema().type()));
            Packet packet = type.create(PacketIdentity.of("x"));
            assertSame(type.packetClass(), packet.getClass());
            assertSame(type, registry.lookup(packet));
        }
    }

    @Test
    void defaultRegistryIsBuiltOnce()
    {
        assertSame(registry, PacketTypeRegistry.defaultRegistry());
    }

    @Test
    void unknownIdentifierFailsWithInvalidType()
    {
        PacketInvalidTypeException e = assertThrows(PacketInvalidTypeException.class,
                () -> registry.lookup("request_teleport"));

        assertEquals(PacketInvalidTypeException.Reason.UNKNOWN_TYPE, e.reason());
        assertEquals("request_teleport", e.typeName());
        assertTrue(e.getMessage().contains("request_teleport"));
        assertTrue(registry.find("request_teleport").isEmpty());
        assertTrue(registry.find(null).isEmpty());
    }

    @Test
    void unregisteredPacketClassFailsWithInvalidType()
    {
        UnregisteredPacket packet = new UnregisteredPacket(PacketIdentity.of("1"));

        PacketInvalidTypeException e =
                assertThrows(PacketInvalidTypeException.class, () -> registry.lookup(packet));
        assertEquals(PacketInvalidTypeException.Reason.UNKNOWN_TYPE, e.reason());
        assertEquals("request_unregistered", e.typeName());
    }

    @Test
    void rejectsDuplicateIdentifiers()
    {
        PacketTypeRegistry.Builder builder = PacketTypeRegistry.builder()
                .register(PacketType.of(InformTransactionComplete.SCHEMA,
                        InformTransactionComplete.class, InformTransactionComplete::new))
                .register(PacketType.of(InformTransactionComplete.SCHEMA,
                        InformTransactionComplete.class, InformTransactionComplete::new));

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void rejectsExpectedReplyThatIsNotRegistered()
    {
        PacketTypeRegistry.Builder builder = PacketTypeRegistry.builder()
                .register(PacketType.of(RequestProjectCreate.SCHEMA,
                        RequestProjectCreate.class, RequestProjectCreate::new));

        IllegalStateException e = assertThrows(IllegalStateException.class, builder::build);
        assertTrue(e.getMessage().contains("notify_project_create"));
    }

    @Test
    void createRoutesFieldsAndCopiesAdditionalSeed()
    {
        PacketType<?> type = registry.lookup("notify_project_create");
        Map<String, Object> seed = new HashMap<>();
        seed.put("SiteNote", "n");

        Packet packet = type.create(PacketIdentity.of("5"), seed,
                Map.of("ProjectID", "p-1", "Extra", 3));
        seed.put("Later", "ignored");

        assertInstanceOf(NotifyProjectCreate.class, packet);
        assertEquals("p-1", packet.get("ProjectID"));
        assertEquals(Map.of("SiteNote", "n", "Extra", 3), packet.additionalData());
    }

    @Test
    void createRejectsSeedWithDeclaredName()
    {
        PacketType<?> type = registry.lookup("notify_project_create");

        assertThrows(IllegalArgumentException.class,
                () -> type.create(PacketIdentity.of("5"), Map.of("ProjectID", "p"), Map.of()));
    }

    @Test
    void factoryMustProduceItsOwnSchema()
    {
        PacketSchema other = PacketSchema.builder("inform_other").build();
        PacketType<InformTransactionComplete> mismatched =
                PacketType.of(other, InformTransactionComplete.class, InformTransactionComplete::new);

        assertThrows(IllegalStateException.class, () -> mismatched.create(PacketIdentity.of("1")));
    }
}
