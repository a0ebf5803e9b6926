package com.hooklight.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hooklight.core.engine.SubagentLifecycleEngine;
import com.hooklight.core.model.HookResponse;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: hooklight subagent-start
 * <p>
 * Reads the spawn event from stdin and prints the hook response. Always exits 0.
 */
@Command(name = "subagent-start", mixinStandardHelpOptions = true,
        description = "Handle a subagent spawn event (JSON on stdin)")
@Component
public class SubagentStartCommand implements Runnable {

    private final SubagentLifecycleEngine engine;
    private final ObjectMapper objectMapper;

    public SubagentStartCommand(SubagentLifecycleEngine engine, ObjectMapper objectMapper) {
        this.engine = engine;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        HookResponse response = HookIo.readInput(objectMapper, System.in)
                .map(engine::onSubagentStart)
                .orElseGet(HookResponse::proceed);
        HookIo.respond(objectMapper, System.out, response);
    }
}
