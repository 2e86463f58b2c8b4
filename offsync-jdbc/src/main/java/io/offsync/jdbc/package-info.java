/**
 * JDBC-backed {@link io.offsync.spi.KeyValueStore}, so queue and cache snapshots can live in
 * the application's database.
 *
 * @see io.offsync.jdbc.JdbcKeyValueStore
 */
package io.offsync.jdbc;
