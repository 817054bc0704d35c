/**
 * Exception taxonomy of the ingest pipeline.
 *
 * <ul>
 *   <li>{@link com.ryuqq.ingest.core.exception.ChannelException} - transient broker error, retried</li>
 *   <li>{@link com.ryuqq.ingest.core.exception.NoMessageAvailableException} - pull timeout, an empty cycle</li>
 *   <li>{@link com.ryuqq.ingest.core.exception.BackendException} - whole-batch backend failure</li>
 *   <li>{@link com.ryuqq.ingest.core.exception.MalformedDocumentException} - bad input, never retried</li>
 *   <li>{@link com.ryuqq.ingest.core.exception.PublishFailedException} - publish retries exhausted</li>
 *   <li>{@link com.ryuqq.ingest.core.exception.ChannelDeclarationException} - fail-fast declaration failure</li>
 *   <li>{@link com.ryuqq.ingest.core.exception.WorkerInterruptedException} - worker interrupted while blocked</li>
 * </ul>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
package com.ryuqq.ingest.core.exception;
