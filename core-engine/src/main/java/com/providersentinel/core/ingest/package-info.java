/**
 * Dataset loaders.
 *
 * <p>
 * Each source (claims, exclusion list, provider registry) is read through
 * {@link com.providersentinel.core.ingest.CsvSource} into typed model records.
 * Unparseable rows are skipped and counted; a missing or unreadable source
 * raises {@link com.providersentinel.core.ingest.DatasetLoadException}.
 * </p>
 *
 * @since 1.0.0
 */
package com.providersentinel.core.ingest;
