/**
 * Routing Strategies
 * =============================================================================
 *
 * Policies that turn (device, message kind, candidate transports) into an
 * ordered list of transports to try. Strategies may probe transports
 * concurrently; they never send and never change transport state.
 *
 * <ul>
 *   <li>{@link com.questrail.meshroute.routing.PriorityRoutingStrategy}: by
 *       ascending priority, optionally keeping only reachable transports</li>
 *   <li>{@link com.questrail.meshroute.routing.QualityRoutingStrategy}: by a
 *       weighted latency, success-rate and link-quality score</li>
 *   <li>{@link com.questrail.meshroute.routing.FailoverRoutingStrategy}: an
 *       explicit order, then the rest</li>
 *   <li>{@link com.questrail.meshroute.routing.MessageTypeRoutingStrategy}:
 *       delegation per message kind</li>
 * </ul>
 */
package com.questrail.meshroute.routing;
