/**
 * MeshWard source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.meshward.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.meshward.runtime.MeshNode} owns a node's tables and periodic loops.</li>
 *   <li>{@code io.meshward.gossip.SignedGossip} signs and screens control messages.</li>
 *   <li>{@code io.meshward.protection.ByzantineProtection} ties gossip to quorum validation.</li>
 * </ul>
 */
package io.meshward;
