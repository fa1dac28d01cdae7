package com.questrail.amie.packet;

import com.questrail.amie.packet.fixtures.NotifyProjectCreate;
import com.questrail.amie.packet.fixtures.RequestProjectCreate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link PacketSchema} declaration and accessor generation.
 */
final class PacketSchemaTest
{
    private static final PacketSchema SCHEMA = PacketSchema.builder("request_widget")
            .required("Name", "StartDate")
            .allowed("Colour")
            .expectedReplies("notify_widget")
            .build();

    @Test
    void schemaKeepsDeclarationOrder()
    {
        assertEquals("request_widget", SCHEMA.type());
        assertEquals(List.of("Name", "StartDate"), SCHEMA.requiredFields());
        assertEquals(List.of("Colour"), SCHEMA.allowedFields());
        assertEquals(List.of("notify_widget"), SCHEMA.expectedReplies());
        assertEquals(List.of("Name", "StartDate", "Colour"), List.copyOf(SCHEMA.accessors().keySet()));
    }

    @Test
    void generatesRequiredAndAllowedAccessors()
    {
        assertInstanceOf(RequiredFieldAccessor.class, SCHEMA.accessor("Name"));
        assertInstanceOf(AllowedFieldAccessor.class, SCHEMA.accessor("Colour"));
        assertTrue(SCHEMA.isRequired("StartDate"));
        assertTrue(SCHEMA.isAllowed("Colour"));
        assertFalse(SCHEMA.declares("Unknown"));

        assertTrue(SCHEMA.accessor("StartDate").dateValued());
        assertFalse(SCHEMA.accessor("Name").dateValued());
    }

    @Test
    void accessorLookupRejectsUndeclaredOrMismatchedNames()
    {
        assertThrows(IllegalArgumentException.class, () -> SCHEMA.accessor("Unknown"));
        assertThrows(IllegalArgumentException.class, () -> SCHEMA.required("Colour"));
        assertThrows(IllegalArgumentException.class, () -> SCHEMA.allowed("Name"));
    }

    @Test
    void rejectsOverlappingRequiredAndAllowedNames()
    {
        PacketSchema.Builder builder = PacketSchema.builder("request_overlap")
                .required("ProjectID")
                .allowed("ProjectID");

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void rejectsDuplicateNamesAndReplies()
    {
        assertThrows(IllegalArgumentException.class,
                () -> PacketSchema.builder("t").required("A", "A").build());
        assertThrows(IllegalArgumentException.class,
                () -> PacketSchema.builder("t").expectedReplies("r", "r").build());
    }

    @Test
    void rejectsBlankIdentifiers()
    {
        assertThrows(IllegalArgumentException.class, () -> PacketSchema.builder(" "));
        assertThrows(IllegalArgumentException.class,
                () -> PacketSchema.builder("t").allowed("").build());
        assertThrows(NullPointerException.class, () -> PacketSchema.builder(null));
    }

    @Test
    void accessorRefusesPacketOfAnotherType()
    {
        RequiredFieldAccessor grantNumber = RequestProjectCreate.SCHEMA.required("GrantNumber");
        NotifyProjectCreate other = new NotifyProjectCreate(PacketIdentity.of("1"));

        assertThrows(IllegalArgumentException.class, () -> grantNumber.get(other));
        assertThrows(IllegalArgumentException.class, () -> grantNumber.set(other, "TG-1"));
        assertFalse(other.requiredFields().containsKey("PiFirstName"));
    }
}
