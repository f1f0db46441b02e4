/**
 * YAML rule configuration and the configuration error type.
 *
 * @since 1.0.0
 */
package com.perfsentinel.core.config;
