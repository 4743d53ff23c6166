/**
 * Public API for the DualLog pipeline.
 *
 * <p>Every log event is rendered twice: the console channel shows the original
 * values, the persisted channel writes a redacted line to a rotating file.</p>
 *
 * <h2>Main Entry Points:</h2>
 * <ul>
 *   <li>{@link io.github.hongjungwan.duallog.api.LogPipeline} - Pipeline lifecycle, file access and queries</li>
 *   <li>{@link io.github.hongjungwan.duallog.api.DualLogger} - Per-caller logging interface</li>
 *   <li>{@link io.github.hongjungwan.duallog.api.redaction.Redacted} - Explicitly marked sensitive values</li>
 *   <li>{@link io.github.hongjungwan.duallog.api.config.DualLogConfig} - Pipeline configuration</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * LogPipeline pipeline = LogPipeline.create(DualLogConfig.forDirectory(Path.of("logs")));
 * DualLogger logger = pipeline.getLogger(CheckoutService.class);
 *
 * logger.info(RedactableMessage.format("Login for {}", Redacted.email("user@example.com")));
 * logger.critical("Payment gateway unreachable");
 *
 * pipeline.close();
 * }</pre>
 */
package io.github.hongjungwan.duallog.api;
