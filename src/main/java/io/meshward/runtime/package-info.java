/**
 * Node runtime package.
 *
 * <p>{@link io.meshward.runtime.MeshNode} is the session object for one node:
 * beacon ingestion, failure reporting, route resolution and the health,
 * evaporation, gossip and key-rotation loops.
 */
package io.meshward.runtime;
