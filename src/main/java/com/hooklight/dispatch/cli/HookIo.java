package com.hooklight.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hooklight.core.model.HookResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * Reads hook input JSON from stdin and writes the response JSON to stdout.
 */
final class HookIo {

    private static final Logger log = LoggerFactory.getLogger(HookIo.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private HookIo() {}

    /**
     * @return the parsed object, or empty when stdin is blank, unreadable, or not a JSON object
     */
    static Optional<Map<String, Object>> readInput(ObjectMapper objectMapper, InputStream in) {
        try {
            String raw = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            if (raw.isBlank()) {
                log.warn("Hook input was empty");
                return Optional.empty();
            }
            return Optional.ofNullable(objectMapper.readValue(raw, MAP_TYPE));
        } catch (JsonProcessingException e) {
            log.warn("Hook input is not a JSON object: {}", e.getOriginalMessage());
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Could not read hook input: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static void respond(ObjectMapper objectMapper, PrintStream out, HookResponse response) {
        try {
            out.println(objectMapper.writeValueAsString(response));
        } catch (JsonProcessingException e) {
            log.error("Could not serialize hook response", e);
            out.println("{\"continue\":true}");
        }
        out.flush();
    }
}
