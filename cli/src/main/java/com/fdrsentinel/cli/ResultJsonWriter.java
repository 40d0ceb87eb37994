package com.fdrsentinel.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fdrsentinel.core.model.DetectionResult;

/**
 * Renders a {@link DetectionResult} as indented JSON.
 *
 * @since 1.0.0
 */
public final class ResultJsonWriter {

    private final ObjectMapper mapper;

    public ResultJsonWriter() {
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String write(DetectionResult result) throws JsonProcessingException {
        return mapper.writeValueAsString(result);
    }
}
