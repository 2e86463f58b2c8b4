/**
 * Built-in dialects and the {@link io.offsync.jdbc.dialect.Dialects} registry.
 */
package io.offsync.jdbc.dialect;
