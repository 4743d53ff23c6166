/**
 * Service Provider Interfaces (SPI) for DualLog.
 *
 * <p>This package contains interfaces for extending the pipeline:</p>
 *
 * <ul>
 *   <li>{@link io.github.hongjungwan.duallog.spi.ConsoleSink} - Destination of the unredacted console channel</li>
 *   <li>{@link io.github.hongjungwan.duallog.spi.RedactionRuleProvider} - Extra scanning rules for the persisted channel</li>
 * </ul>
 *
 * <h2>Registration:</h2>
 * <p>Redaction rule providers are discovered via ServiceLoader:</p>
 * <pre>
 * META-INF/services/io.github.hongjungwan.duallog.spi.RedactionRuleProvider
 * </pre>
 * <p>A console sink is passed to the pipeline constructor.</p>
 *
 * @since 1.0.0
 */
package io.github.hongjungwan.duallog.spi;
