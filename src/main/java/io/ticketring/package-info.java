/**
 * TicketRing source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.ticketring.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.ticketring.cli.TicketRingCommand} maps commands to the operations below.</li>
 *   <li>{@code io.ticketring.rotation.RotationEngine} is the time-gated three-slot rotation.</li>
 *   <li>{@code io.ticketring.storage.KeyCacheStore} is the authoritative per-region persistence layer.</li>
 *   <li>{@code io.ticketring.sync.RuntimeSyncClient} talks to running load balancers; persisted and
 *       runtime state only meet in {@code io.ticketring.sync.FleetReconciler}.</li>
 * </ul>
 */
package io.ticketring;
