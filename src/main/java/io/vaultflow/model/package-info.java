/**
 * Task and approval data model.
 *
 * <p>{@link io.vaultflow.model.TaskRecord} is the typed form of a task file and is only
 * produced by {@link io.vaultflow.codec.TaskFileCodec}. States are the closed
 * {@link io.vaultflow.model.TaskState} enumeration, so an illegal state can not be
 * represented once a file has been decoded.
 */
package io.vaultflow.model;
