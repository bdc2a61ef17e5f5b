/**
 * Batch job that runs one provider scan end to end: environment
 * configuration, dataset loading, detection, composition and JSON output.
 *
 * @since 1.0.0
 */
package com.providersentinel.job;
