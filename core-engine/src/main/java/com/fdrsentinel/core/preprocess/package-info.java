/**
 * Stages that turn a raw flight table into scaled, windowed numeric input:
 * time resolution, feature selection, fill and scaling, windowing.
 */
package com.fdrsentinel.core.preprocess;
