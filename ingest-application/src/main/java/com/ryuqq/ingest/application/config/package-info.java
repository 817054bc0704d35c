/**
 * Configuration records and the Typesafe Config loader.
 *
 * @author Ingest Team
 * @since 1.0.0
 */
package com.ryuqq.ingest.application.config;
