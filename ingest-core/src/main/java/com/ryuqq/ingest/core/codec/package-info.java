/**
 * JSON encoding of indexing actions (Jackson).
 *
 * @author Ingest Team
 * @since 1.0.0
 */
package com.ryuqq.ingest.core.codec;
