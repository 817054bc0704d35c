/**
 * Data model of the ingest pipeline.
 *
 * <ul>
 *   <li>{@link com.ryuqq.ingest.core.model.IndexingAction} - envelope placed on the durable channel</li>
 *   <li>{@link com.ryuqq.ingest.core.model.ActionId} - per-publish unique id</li>
 *   <li>{@link com.ryuqq.ingest.core.model.DocumentRouting} - where a document declares its tenant and pattern</li>
 * </ul>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
package com.ryuqq.ingest.core.model;
