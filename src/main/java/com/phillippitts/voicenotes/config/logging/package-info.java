/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - set by {@link com.phillippitts.voicenotes.config.logging.MdcFilter}
 *       for every HTTP request</li>
 *   <li>{@code pipelineRunId} - set by the pipeline orchestrator for the duration of a run</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-10-17 15:42:32.529 [thread-name] [requestId] [pipelineRunId] LEVEL logger.name - message
 * </pre>
 */
package com.phillippitts.voicenotes.config.logging;
