/**
 * Report composition: merges signal hits into per-provider reports, attaches
 * False Claims Act relevance and computes the run-level counts.
 *
 * @since 1.0.0
 */
package com.providersentinel.core.report;
