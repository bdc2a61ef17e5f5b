/**
 * Domain model classes for Provider Sentinel.
 *
 * <p>
 * Typed records produced at the loader boundary
 * ({@link com.providersentinel.core.model.Claim},
 * {@link com.providersentinel.core.model.ExclusionRecord},
 * {@link com.providersentinel.core.model.RegistryEntity}), the resolved
 * {@link com.providersentinel.core.model.ProviderView}, detector output
 * ({@link com.providersentinel.core.model.SignalHit}) and the
 * {@link com.providersentinel.core.model.SignalRule} configuration POJO.
 * </p>
 *
 * @since 1.0.0
 */
package com.providersentinel.core.model;
