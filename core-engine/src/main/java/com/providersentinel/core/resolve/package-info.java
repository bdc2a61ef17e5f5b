/**
 * Entity resolution: identifier validation and the join of claims, registry
 * and exclusion records into one
 * {@link com.providersentinel.core.model.ProviderView} per valid identifier.
 *
 * @since 1.0.0
 */
package com.providersentinel.core.resolve;
