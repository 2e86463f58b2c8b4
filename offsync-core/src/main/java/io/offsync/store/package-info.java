/**
 * Durable storage: the best-effort {@link io.offsync.store.DurableStore} facade and the
 * in-memory and file-backed key-value stores.
 */
package io.offsync.store;
