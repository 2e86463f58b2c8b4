/**
 * Prefetch cache: read-ahead with freshness, capacity eviction and in-flight deduplication.
 */
package io.offsync.cache;
