/**
 * Graceful shutdown over the component dependency tree.
 *
 * <p>Every node asks its dependents to stop, waits half of its stop timeout, then kills
 * whichever are still running. A node terminates itself only after all of its dependents
 * are gone, so stop handlers always run leaves-first.
 */
package com.libragraph.steward.core.shutdown;
