/**
 * AMIE packet model.
 *
 * <p>A {@link com.questrail.amie.packet.PacketSchema} declares a packet type's
 * required fields, allowed fields and permitted replies, and generates the
 * {@link com.questrail.amie.packet.FieldAccessor}s through which a
 * {@link com.questrail.amie.packet.Packet} instance's data is read and written.</p>
 *
 * <pre>
 *   PacketSchema  → accessors
 *   PacketIdentity + PacketSchema → Packet → check()/validate()
 * </pre>
 *
 * <p>Type lookup lives in {@code packet.registry}, reply construction in
 * {@code packet.reply}, and the wire envelope in {@code packet.codec}.</p>
 */
package com.questrail.amie.packet;
