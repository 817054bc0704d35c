/**
 * Startup declaration of the durable channel.
 *
 * @author Ingest Team
 * @since 1.0.0
 */
package com.ryuqq.ingest.application.bootstrap;
