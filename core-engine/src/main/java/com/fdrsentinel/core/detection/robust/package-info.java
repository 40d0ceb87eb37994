/**
 * Row-level robust scoring: rolling median/MAD z-scores and an isolation
 * forest.
 */
package com.fdrsentinel.core.detection.robust;
