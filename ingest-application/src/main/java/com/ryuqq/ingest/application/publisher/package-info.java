/**
 * Publish side of the pipeline: document to indexing action to durable channel.
 *
 * @author Ingest Team
 * @since 1.0.0
 */
package com.ryuqq.ingest.application.publisher;
