/**
 * Transport Ports
 * =============================================================================
 *
 * The boundary between concrete communication channels (local network,
 * short-range radio, relay station) and the routing core.
 *
 * <p>Everything above this package sees a channel only as a
 * {@link com.questrail.meshroute.transport.Transport}: an id, a priority,
 * availability and initialization flags, a reachability probe, a quality
 * score, a timeout-bounded send and an inbound
 * {@link com.questrail.meshroute.transport.MessageStream}.</p>
 *
 * <h2>Constraints on implementations</h2>
 * <ul>
 *   <li>Carry messages only; no routing decisions and no queueing</li>
 *   <li>Never complete a send exceptionally for a timeout; return a failure
 *       result instead</li>
 *   <li>Answer {@code canReach} quickly, preferably from the
 *       {@link com.questrail.meshroute.transport.DeviceRegistry}</li>
 *   <li>Compose {@link com.questrail.meshroute.transport.TransportSupport}
 *       for shared state rather than extending a base class</li>
 * </ul>
 */
package com.questrail.meshroute.transport;
