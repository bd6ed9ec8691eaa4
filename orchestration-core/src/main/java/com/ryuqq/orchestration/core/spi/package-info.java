/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Adapters implement {@link com.ryuqq.orchestration.core.spi.ProviderClient} to connect
 * the router to a concrete upstream compute provider.</p>
 *
 * @since 1.0.0
 * @author Orchestration Team
 */
package com.ryuqq.orchestration.core.spi;
