/**
 * Telegram Transport Ports
 * =============================================================================
 *
 * <p>These interfaces define the framework-agnostic boundary between a concrete
 * networking implementation (Netty TCP, or a test double) and the connection
 * manager.</p>
 *
 * <p>Everything above the port sees only:</p>
 * <ul>
 *   <li>raw chunks as {@code byte[]}, with arbitrary boundaries</li>
 *   <li>an inbound-closed notification</li>
 *   <li>blocking, time-bounded {@code open} and {@code write}</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only</li>
 *   <li>Not reassemble or decode telegrams</li>
 *   <li>Not retry, reconnect or schedule anything</li>
 * </ul>
 */
package com.questrail.plcsim.protocol.telegram.transport;
