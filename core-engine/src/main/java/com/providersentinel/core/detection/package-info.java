/**
 * Signal detection.
 *
 * <p>
 * Contains the {@link com.providersentinel.core.detection.SignalDetector}
 * contract, one implementation per
 * {@link com.providersentinel.core.model.SignalKind}, the
 * {@link com.providersentinel.core.detection.SignalDetectorFactory} that
 * builds them from configuration, and the
 * {@link com.providersentinel.core.detection.SignalEngine} that runs them
 * concurrently.
 * </p>
 *
 * @since 1.0.0
 */
package com.providersentinel.core.detection;
