package com.questrail.amie.packet.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.questrail.amie.observability.PacketCodecEvent;
import com.questrail.amie.observability.PacketErrorEvent;
import com.questrail.amie.observability.PacketObservabilitySink;
import com.questrail.amie.packet.AmiePacketException;
import com.questrail.amie.packet.DateFields;
import com.questrail.amie.packet.Packet;
import com.questrail.amie.packet.PacketIdentity;
import com.questrail.amie.packet.PacketInvalidDataException;
import com.questrail.amie.packet.ReplyTo;
import com.questrail.amie.packet.registry.PacketType;
import com.questrail.amie.packet.registry.PacketTypeRegistry;

import java.time.OffsetDateTime;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * PacketCodec
 * ============================================================================
 * Converts between {@link Packet} instances and the AMIE envelope, either as
 * nested maps or as JSON text.
 *
 * <h2>Outbound</h2>
 * <pre>
 *   Packet  ->  Map (envelope)  ->  JSON
 * </pre>
 * <p>
 * The body merges required, allowed and additional data, in that order, and
 * leaves out every field whose value is {@code null}. Temporal values are
 * written as ISO-8601 strings.
 * </p>
 *
 * <h2>Inbound</h2>
 * <pre>
 *   JSON  ->  Map (envelope)  ->  registry lookup  ->  Packet
 * </pre>
 * <p>
 * The type identifier is read from {@code header.type}; a top-level
 * {@code type} key is accepted as a fallback. Body entries are routed exactly
 * as at construction: declared names through their accessors, everything else
 * into additional data.
 * </p>
 *
 * <h2>What this codec does NOT do</h2>
 * <ul>
 *   <li>Validate required data (see {@link Packet#validate()})</li>
 *   <li>Perform transport I/O</li>
 * </ul>
 */
public final class PacketCodec
{
    private static final TypeReference<LinkedHashMap<String, Object>> ENVELOPE_TYPE =
            new TypeReference<>() {};

    private final PacketTypeRegistry registry;
    private final PacketCodecConfig config;
    private final PacketObservabilitySink sink;
    private final ObjectMapper mapper;

    public PacketCodec(PacketTypeRegistry registry) {
        this(registry, PacketCodecConfig.defaults());
    }

    public PacketCodec(PacketTypeRegistry registry, PacketCodecConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.config = Objects.requireNonNull(config, "config");
        this.sink = config.observabilitySink();
        this.mapper = new ObjectMapper();
        mapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        if (config.prettyPrint()) {
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
    }

    // ========================================================================
    // Outbound
    // ========================================================================

    /**
     * Returns the packet as an envelope of nested, insertion-ordered maps.
     */
    public Map<String, Object> toMap(Packet packet) {
        Objects.requireNonNull(packet, "packet");

        Map<String, Object> body = new LinkedHashMap<>();
        appendBody(body, packet.requiredFields());
        appendBody(body, packet.allowedFields());
        appendBody(body, packet.additionalData());

        Map<String, Object> header = new LinkedHashMap<>();
        header.put(PacketEnvelope.PACKET_ID, packet.packetId());
        header.put(PacketEnvelope.DATE, DateFields.format(packet.date()));
        header.put(PacketEnvelope.TYPE, packet.packetType());
        header.put(PacketEnvelope.EXPECTED_REPLY_LIST, new ArrayList<>(packet.expectedReplies()));
        if (packet.inReplyToId() != null) {
            header.put(PacketEnvelope.IN_REPLY_TO, packet.inReplyToId());
        }

        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put(PacketEnvelope.DATA_TYPE, PacketEnvelope.DATA_TYPE_PACKET);
        envelope.put(PacketEnvelope.HEADER, header);
        envelope.put(PacketEnvelope.BODY, body);

        sink.onEncoded(event(packet));
        return envelope;
    }

    /**
     * Returns the packet's envelope as JSON text.
     *
     * @throws PacketEncodeException if a body value cannot be written as JSON
     */
    public String toJson(Packet packet) {
        Map<String, Object> envelope = toMap(packet);
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            PacketEncodeException failure = new PacketEncodeException(
                    "Failed to write " + packet.packetType() + " packet "
                            + packet.packetId() + " as JSON", e);
            sink.onError(new PacketErrorEvent(config.clock().now(), failure.getMessage(), e));
            throw failure;
        }
    }

    private static void appendBody(Map<String, Object> body, Map<String, Object> fields) {
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Temporal temporal) {
                body.put(entry.getKey(), DateFields.format(temporal));
            } else if (value instanceof Date date) {
                body.put(entry.getKey(), date.toInstant().toString());
            } else if (value != null) {
                body.put(entry.getKey(), value);
            }
        }
    }

    // ========================================================================
    // Inbound
    // ========================================================================

    /**
     * Builds a packet from an envelope map.
     *
     * @throws PacketDecodeException if the envelope is malformed
     * @throws com.questrail.amie.packet.PacketInvalidTypeException if the type is not registered
     * @throws PacketInvalidDataException if a date-valued body field cannot be parsed
     */
    public Packet fromMap(Map<String, ?> envelope) {
        Objects.requireNonNull(envelope, "envelope");
        try {
            Packet packet = decode(envelope);
            sink.onDecoded(event(packet));
            return packet;
        } catch (AmiePacketException e) {
            sink.onError(new PacketErrorEvent(config.clock().now(), e.getMessage(), e));
            throw e;
        }
    }

    /**
     * Builds a packet from JSON text.
     *
     * @throws PacketDecodeException if the text is not a JSON object or the envelope is malformed
     */
    public Packet fromJson(String json) {
        Objects.requireNonNull(json, "json");
        Map<String, Object> envelope;
        try {
            envelope = mapper.readValue(json, ENVELOPE_TYPE);
        } catch (JsonProcessingException e) {
            PacketDecodeException failure =
                    new PacketDecodeException("Failed to parse packet JSON", e);
            sink.onError(new PacketErrorEvent(config.clock().now(), failure.getMessage(), e));
            throw failure;
        }
        if (envelope == null) {
            PacketDecodeException failure = new PacketDecodeException("Packet JSON is null");
            sink.onError(new PacketErrorEvent(config.clock().now(), failure.getMessage(), failure));
            throw failure;
        }
        return fromMap(envelope);
    }

    private Packet decode(Map<String, ?> envelope) {
        Object dataType = envelope.get(PacketEnvelope.DATA_TYPE);
        if (dataType != null && !PacketEnvelope.DATA_TYPE_PACKET.equals(dataType)) {
            throw new PacketDecodeException("Unsupported DATA_TYPE '" + dataType + "'");
        }

        if (!(envelope.get(PacketEnvelope.HEADER) instanceof Map<?, ?> header)) {
            throw new PacketDecodeException("Envelope has no header object");
        }

        Object typeName = header.get(PacketEnvelope.TYPE);
        if (typeName == null) {
            typeName = envelope.get(PacketEnvelope.TYPE);
        }
        if (typeName == null) {
            throw new PacketDecodeException("Envelope declares no packet type");
        }
        PacketType<?> type = registry.lookup(String.valueOf(typeName));

        PacketIdentity identity = PacketIdentity.builder()
                .packetId(header.get(PacketEnvelope.PACKET_ID))
                .date(headerDate(header.get(PacketEnvelope.DATE)))
                .inReplyTo(replyTo(header.get(PacketEnvelope.IN_REPLY_TO)))
                .clock(config.clock())
                .build();

        return type.create(identity, body(envelope.get(PacketEnvelope.BODY)));
    }

    private static OffsetDateTime headerDate(Object raw) {
        try {
            return DateFields.toTimestamp(PacketEnvelope.DATE, raw);
        } catch (PacketInvalidDataException e) {
            throw new PacketDecodeException("Envelope header date is invalid: " + raw, e);
        }
    }

    private static ReplyTo replyTo(Object raw) {
        try {
            return ReplyTo.from(raw);
        } catch (IllegalArgumentException e) {
            throw new PacketDecodeException("Envelope header in_reply_to is invalid", e);
        }
    }

    private static Map<String, Object> body(Object raw) {
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new PacketDecodeException("Envelope body is not an object");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        map.forEach((key, value) -> body.put(String.valueOf(key), value));
        return body;
    }

    private PacketCodecEvent event(Packet packet) {
        return new PacketCodecEvent(
                config.clock().now(),
                packet.packetType(),
                packet.packetId(),
                packet.inReplyToId());
    }
}
