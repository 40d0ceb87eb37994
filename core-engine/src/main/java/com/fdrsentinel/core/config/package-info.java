/**
 * Configuration of the detection pipeline.
 *
 * <p>
 * {@link com.fdrsentinel.core.config.DetectionConfig} is the immutable value
 * object every stage receives. It is built programmatically, from
 * environment variables at the process boundary, or from YAML via
 * {@link com.fdrsentinel.core.config.DetectionConfigLoader}, which binds a
 * {@link com.fdrsentinel.core.config.DetectionSettings} POJO and validates it
 * before conversion.
 * </p>
 *
 * @since 1.0.0
 */
package com.fdrsentinel.core.config;
