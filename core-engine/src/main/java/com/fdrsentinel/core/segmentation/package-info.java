/**
 * Folding window scores onto rows and grouping anomalous rows into segments.
 */
package com.fdrsentinel.core.segmentation;
