package com.dnagraph.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Pretty-printed JSON on standard output, for commands run with {@code --json}.
 */
@Component
public class JsonOutput {

    private final ObjectMapper objectMapper;

    public JsonOutput(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void print(Object value) throws JsonProcessingException {
        System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
    }
}
