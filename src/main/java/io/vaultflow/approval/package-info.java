/**
 * Approval requests, decisions and the consumed-nonce ledger.
 */
package io.vaultflow.approval;
