/**
 * Failure taxonomy of the activity pipeline.
 * <p>All types are unchecked and extend {@link org.cerespp.domain.error.ActivityPipelineException}.
 * Sample-level and index-level failures become gaps in partial results; fit and shift failures end the
 * run for one observation only.</p>
 *
 * @since 0.1.0
 */
package org.cerespp.domain.error;
