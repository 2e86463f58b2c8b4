/**
 * Spring Boot auto-configuration for offsync.
 *
 * @see io.offsync.spring.boot.OffsyncAutoConfiguration
 */
package io.offsync.spring.boot;
