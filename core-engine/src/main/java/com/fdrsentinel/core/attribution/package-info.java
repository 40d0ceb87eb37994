/**
 * Driver ranking, baseline comparison, explanations and run summaries.
 */
package com.fdrsentinel.core.attribution;
