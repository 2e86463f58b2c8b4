/**
 * Connectivity monitors: manually driven and probe-based.
 */
package io.offsync.connectivity;
