/**
 * Static lifecycle tables.
 *
 * <p>{@link io.vaultflow.graph.TransitionGraph} holds the legal state edges and the
 * directory-state licensing table. The engine and {@code io.vaultflow.audit} both read
 * these tables; neither keeps its own copy.
 */
package io.vaultflow.graph;
