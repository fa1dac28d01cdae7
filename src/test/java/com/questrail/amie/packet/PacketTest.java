package com.questrail.amie.packet;

import com.questrail.amie.packet.fixtures.RequestProjectCreate;
import com.questrail.amie.time.ManualWallClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the {@link Packet} field stores and identity.
 */
final class PacketTest
{
    private static RequestProjectCreate newRequest(String packetId) {
        return new RequestProjectCreate(PacketIdentity.of(packetId));
    }

    @Test
    void requiredDataHoldsExactlyTheSchemaNames()
    {
        RequestProjectCreate packet = newRequest("1");

        assertEquals(RequestProjectCreate.SCHEMA.requiredFields(),
                List.copyOf(packet.requiredFields().keySet()));
        assertTrue(packet.requiredFields().values().stream().allMatch(v -> v == null));
        assertTrue(packet.allowedFields().isEmpty());
        assertTrue(packet.additionalData().isEmpty());
    }

    @Test
    void resetRequiredFieldKeepsKeyWithNullValue()
    {
        RequestProjectCreate packet = newRequest("1");
        packet.setGrantNumber("TG-ABC123");
        assertEquals("TG-ABC123", packet.getGrantNumber());

        packet.reset("GrantNumber");

        assertTrue(packet.requiredFields().containsKey("GrantNumber"));
        assertNull(packet.getGrantNumber());
    }

    @Test
    void resetAllowedFieldRemovesIt()
    {
        RequestProjectCreate packet = newRequest("1");
        packet.setProjectTitle("Turbulence");
        assertEquals(Map.of("ProjectTitle", "Turbulence"), packet.allowedFields());

        packet.reset("ProjectTitle");

        assertFalse(packet.allowedFields().containsKey("ProjectTitle"));
        assertNull(packet.getProjectTitle());
    }

    @Test
    void nameCheckedHelpersRejectUndeclaredFields()
    {
        RequestProjectCreate packet = newRequest("1");

        assertThrows(IllegalArgumentException.class, () -> packet.get("Nope"));
        assertThrows(IllegalArgumentException.class, () -> packet.set("Nope", 1));
        assertThrows(IllegalArgumentException.class, () -> packet.reset("Nope"));
    }

    @Test
    void fieldViewsAreReadOnly()
    {
        RequestProjectCreate packet = newRequest("1");

        assertThrows(UnsupportedOperationException.class,
                () -> packet.requiredFields().put("Extra", "x"));
        assertThrows(UnsupportedOperationException.class,
                () -> packet.additionalData().put("Extra", "x"));
    }

    @Test
    void applyFieldsRoutesDeclaredAndUndeclaredNames()
    {
        RequestProjectCreate packet = newRequest("1");
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("GrantNumber", "TG-1");
        fields.put("ProjectTitle", "Climate");
        fields.put("SiteLocalNote", "keep me");

        packet.applyFields(fields);

        assertEquals("TG-1", packet.requiredFields().get("GrantNumber"));
        assertEquals("Climate", packet.allowedFields().get("ProjectTitle"));
        assertEquals(Map.of("SiteLocalNote", "keep me"), packet.additionalData());
    }

    @Test
    void dateNamedFieldsAreStoredAsTimestamps()
    {
        RequestProjectCreate packet = newRequest("1");

        packet.applyFields(Map.of("StartDate", "2021-03-04T05:06:07Z"));
        packet.set("EndDate", "2022-03-04");

        assertEquals(OffsetDateTime.of(2021, 3, 4, 5, 6, 7, 0, ZoneOffset.UTC), packet.getStartDate());
        assertEquals(OffsetDateTime.of(2022, 3, 4, 0, 0, 0, 0, ZoneOffset.UTC), packet.get("EndDate"));
    }

    @Test
    void unparseableDateIsRejectedWithFieldName()
    {
        RequestProjectCreate packet = newRequest("1");

        PacketInvalidDataException e = assertThrows(PacketInvalidDataException.class,
                () -> packet.set("StartDate", "next tuesday"));
        assertEquals("StartDate", e.fieldName());
    }

    @Test
    void undeclaredDateLikeNamesStayVerbatim()
    {
        RequestProjectCreate packet = newRequest("1");

        packet.applyFields(Map.of("LocalUpdateDate", "2021-01-01"));

        assertEquals("2021-01-01", packet.additionalData().get("LocalUpdateDate"));
    }

    @Test
    void eachInstanceOwnsItsAdditionalData()
    {
        RequestProjectCreate first = newRequest("1");
        RequestProjectCreate second = newRequest("2");

        first.putAdditional("Scratch", 1);

        assertEquals(Map.of("Scratch", 1), first.additionalData());
        assertTrue(second.additionalData().isEmpty());
    }

    @Test
    void putAdditionalRejectsDeclaredNames()
    {
        RequestProjectCreate packet = newRequest("1");

        assertThrows(IllegalArgumentException.class, () -> packet.putAdditional("GrantNumber", "x"));
        assertThrows(IllegalArgumentException.class, () -> packet.putAdditional("ProjectTitle", "x"));
    }

    @Test
    void dateDefaultsToInjectedClock()
    {
        ManualWallClock clock = new ManualWallClock(Instant.parse("2020-06-01T12:00:00Z"));

        RequestProjectCreate packet = new RequestProjectCreate(
                PacketIdentity.builder().packetId(7).clock(clock).build());

        assertEquals("7", packet.packetId());
        assertEquals(OffsetDateTime.parse("2020-06-01T12:00:00Z"), packet.date());
    }

    @Test
    void explicitDateWinsOverClock()
    {
        OffsetDateTime date = OffsetDateTime.parse("2019-01-01T00:00:00+02:00");

        RequestProjectCreate packet = new RequestProjectCreate(
                PacketIdentity.builder().date(date).build());

        assertEquals(date, packet.date());
        assertNull(packet.packetId());
    }

    @Test
    void packetIdMayBeAssignedAfterConstruction()
    {
        RequestProjectCreate packet = newRequest(null);
        assertNull(packet.packetId());

        packet.setPacketId("42");

        assertEquals("42", packet.packetId());
    }

    @Test
    void replyLinkageIsReducedToAnId()
    {
        RequestProjectCreate source = newRequest("100");
        RequestProjectCreate reply = new RequestProjectCreate(
                PacketIdentity.builder().packetId("101").inReplyTo(ReplyTo.packet(source)).build());

        assertEquals("100", reply.inReplyToId());
        assertTrue(reply.isReply());

        reply.setInReplyTo(ReplyTo.none());
        assertFalse(reply.isReply());
    }

    @Test
    void typeMetadataComesFromSchema()
    {
        RequestProjectCreate packet = newRequest("1");

        assertEquals("request_project_create", packet.packetType());
        assertEquals(Arrays.asList("notify_project_create"), packet.expectedReplies());
        assertSame(RequestProjectCreate.SCHEMA, packet.schema());
    }
}
