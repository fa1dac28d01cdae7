/**
 * AMIE envelope codec.
 *
 * <pre>
 *   Packet ⇄ { "DATA_TYPE": "packet", "header": {...}, "body": {...} } ⇄ JSON
 * </pre>
 *
 * <p>JSON text handling is delegated to Jackson. The codec sits above any
 * transport; sending and receiving envelopes is the caller's concern.</p>
 */
package com.questrail.amie.packet.codec;
