package com.questrail.amie.packet.codec;

/**
 * Key names of the AMIE packet envelope.
 *
 * <pre>
 * {
 *   "DATA_TYPE": "packet",
 *   "header": {
 *     "packet_id": "...",
 *     "date": "ISO-8601",
 *     "type": "request_project_create",
 *     "expected_reply_list": ["notify_project_create"],
 *     "in_reply_to": "..."          (only when set)
 *   },
 *   "body": { ... }                 (only non-null fields)
 * }
 * </pre>
 */
public final class PacketEnvelope
{
    public static final String DATA_TYPE = "DATA_TYPE";
    public static final String DATA_TYPE_PACKET = "packet";
    public static final String HEADER = "header";
    public static final String BODY = "body";

    public static final String PACKET_ID = "packet_id";
    public static final String DATE = "date";
    public static final String TYPE = "type";
    public static final String EXPECTED_REPLY_LIST = "expected_reply_list";
    public static final String IN_REPLY_TO = "in_reply_to";

    private PacketEnvelope() {
    }
}
