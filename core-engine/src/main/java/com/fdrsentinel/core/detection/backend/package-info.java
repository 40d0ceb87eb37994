/**
 * Reconstruction backends for the windowed strategy and the capability-based
 * selection between them.
 */
package com.fdrsentinel.core.detection.backend;
