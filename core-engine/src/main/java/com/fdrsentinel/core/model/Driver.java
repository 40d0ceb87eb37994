package com.fdrsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A feature that contributed to a segment being flagged, with the magnitude
 * it was ranked by: mean reconstruction error, or maximum absolute robust z.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "parameter", "error", "max_robust_z" })
public final class Driver {

    @JsonProperty("parameter")
    private final String parameter;

    @JsonProperty("error")
    private final Double error;

    @JsonProperty("max_robust_z")
    private final Double maxRobustZ;

    private Driver(String parameter, Double error, Double maxRobustZ) {
        this.parameter = Objects.requireNonNull(parameter, "parameter must not be null");
        this.error = error;
        this.maxRobustZ = maxRobustZ;
    }

    public static Driver ofError(String parameter, double error) {
        return new Driver(parameter, error, null);
    }

    public static Driver ofRobustZ(String parameter, double maxRobustZ) {
        return new Driver(parameter, null, maxRobustZ);
    }

    public String getParameter() {
        return parameter;
    }

    public Double getError() {
        return error;
    }

    public Double getMaxRobustZ() {
        return maxRobustZ;
    }

    /**
     * @return whichever magnitude this driver was ranked by
     */
    public double magnitude() {
        return error != null ? error : maxRobustZ;
    }

    @Override
    public String toString() {
        return "Driver{" + parameter + '=' + magnitude() + '}';
    }
}
