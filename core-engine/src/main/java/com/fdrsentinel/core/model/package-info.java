/**
 * Typed input table, intermediate matrices and the serializable result model.
 */
package com.fdrsentinel.core.model;
