/**
 * Worker runtime contract.
 *
 * @author Ingest Team
 * @since 1.0.0
 */
package com.ryuqq.ingest.application.runtime;
