/**
 * <p>Support for AES67 streams: hearing them announced with SAP, remembering them, and telling Dante devices to
 * receive them.</p>
 *
 * <p>The {@link org.deepsymmetry.dantelink.aes67.SapListener} collects announcements, which
 * {@link org.deepsymmetry.dantelink.aes67.SapPacket} turns into
 * {@link org.deepsymmetry.dantelink.aes67.StreamInfo} objects kept in a
 * {@link org.deepsymmetry.dantelink.aes67.StreamCache}. The
 * {@link org.deepsymmetry.dantelink.aes67.SubscribeCommand} was worked out from captures of Dante Controller
 * traffic, and has only been seen to work for the stream formats it knows about.</p>
 */
package org.deepsymmetry.dantelink.aes67;
