package com.fdrsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * How many segments named a parameter among their top drivers.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "parameter", "count" })
public final class DriverCount {

    @JsonProperty("parameter")
    private final String parameter;

    @JsonProperty("count")
    private final int count;

    public DriverCount(String parameter, int count) {
        this.parameter = parameter;
        this.count = count;
    }

    public String getParameter() {
        return parameter;
    }

    public int getCount() {
        return count;
    }

    @Override
    public String toString() {
        return parameter + '=' + count;
    }
}
