/**
 * Telegram Codec
 * =============================================================================
 *
 * <p>Wire-level rules for the fixed-length ASCII telegram exchanged between the
 * simulated PLC and the warehouse-management host.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte stream
 *        → TelegramStreamAccumulator   (frame boundaries, overflow)
 *            → TelegramCodec.decode    (128 bytes → Telegram)
 *                → TelegramReceived event
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>The codec never assigns sequence numbers; the simulation engine does.</li>
 *   <li>The codec never sees a partial frame; the accumulator holds those back.</li>
 *   <li>Decoding is total: a misbehaving peer cannot stop the simulator by
 *       sending garbage.</li>
 * </ul>
 */
package com.questrail.plcsim.protocol.telegram.codec;
