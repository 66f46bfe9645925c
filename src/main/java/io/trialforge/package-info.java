/**
 * TrialForge source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.trialforge.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.trialforge.cli.TrialForgeCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.trialforge.runtime.TrialForgeRuntime} wires scheduling, shaping, replay and lifecycle components.</li>
 *   <li>{@code io.trialforge.ledger.Ledger} is the authoritative trial history.</li>
 * </ul>
 */
package io.trialforge;
