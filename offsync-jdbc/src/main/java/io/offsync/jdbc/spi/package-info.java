/**
 * Dialect SPI for the JDBC key-value store.
 */
package io.offsync.jdbc.spi;
