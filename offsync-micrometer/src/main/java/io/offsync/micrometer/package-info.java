/**
 * Micrometer bridge for {@link io.offsync.spi.MetricsExporter}.
 */
package io.offsync.micrometer;
