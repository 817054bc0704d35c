/**
 * In-memory, scriptable search backend used by tests and local runs.
 *
 * @author Ingest Team
 * @since 1.0.0
 */
package com.ryuqq.ingest.adapter.inmemory.backend;
