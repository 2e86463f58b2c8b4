/**
 * Service provider interfaces: durable key-value storage, connectivity and metrics.
 */
package io.offsync.spi;
