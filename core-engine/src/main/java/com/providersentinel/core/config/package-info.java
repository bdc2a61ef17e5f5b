/**
 * Configuration loading and validation for the signal detectors.
 *
 * <p>
 * Rules are defined in YAML and loaded by
 * {@link com.providersentinel.core.config.SignalRulesLoader} into a
 * {@link com.providersentinel.core.config.SignalRulesConfig} instance.
 * Validation runs right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.providersentinel.core.config;
