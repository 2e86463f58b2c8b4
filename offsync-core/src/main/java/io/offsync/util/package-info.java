/**
 * Internal utilities: JSON codec and thread factory.
 */
package io.offsync.util;
