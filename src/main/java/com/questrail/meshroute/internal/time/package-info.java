/**
 * Monotonic time, scheduling and deadlines for the routing core. Not part of
 * the public API.
 */
package com.questrail.meshroute.internal.time;
