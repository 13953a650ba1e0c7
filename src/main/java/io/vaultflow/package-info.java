/**
 * VaultFlow source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.vaultflow.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.vaultflow.cli.VaultFlowCommand} maps commands to runtime operations.</li>
 *   <li>{@code io.vaultflow.engine.TaskRelocator} is the only code that moves or rewrites task files.</li>
 *   <li>{@code io.vaultflow.approval.ApprovalGate} records human decisions on pending approvals.</li>
 *   <li>{@code io.vaultflow.audit.ConsistencyAuditor} checks a vault without touching it.</li>
 * </ul>
 */
package io.vaultflow;
