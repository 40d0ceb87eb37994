/**
 * Numeric helpers (percentiles, medians, tolerance checks, rounding) built on
 * Apache Commons Math.
 *
 * @since 1.0.0
 */
package com.fdrsentinel.core.stats;
