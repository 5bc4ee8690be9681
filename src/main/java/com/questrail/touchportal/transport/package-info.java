/**
 * Controller Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty TCP, a test double) and
 * the connection loop.
 *
 * <h2>Why these ports exist</h2>
 * Netty is used in production for the socket work without allowing Netty types
 * to leak into the connection, dispatch or state code. Everything above the
 * adapter sees only:
 * <ul>
 *   <li>Raw stream chunks as {@code byte[]}, split wherever the network split them</li>
 *   <li>A single closed notification with an optional cause</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only</li>
 *   <li>Not split lines or decode JSON</li>
 *   <li>Not reconnect on their own</li>
 * </ul>
 */
package com.questrail.touchportal.transport;
