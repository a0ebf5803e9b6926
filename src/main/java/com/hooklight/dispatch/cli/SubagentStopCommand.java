package com.hooklight.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hooklight.core.engine.SubagentLifecycleEngine;
import com.hooklight.core.model.HookResponse;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: hooklight subagent-stop
 * <p>
 * Reads the stop event from stdin, verifies the agent's work, writes telemetry for correlated
 * runs and prints the hook response. Always exits 0.
 */
@Command(name = "subagent-stop", mixinStandardHelpOptions = true,
        description = "Handle a subagent stop event (JSON on stdin)")
@Component
public class SubagentStopCommand implements Runnable {

    private final SubagentLifecycleEngine engine;
    private final ObjectMapper objectMapper;

    public SubagentStopCommand(SubagentLifecycleEngine engine, ObjectMapper objectMapper) {
        this.engine = engine;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        HookResponse response = HookIo.readInput(objectMapper, System.in)
                .map(engine::onSubagentStop)
                .orElseGet(HookResponse::proceed);
        HookIo.respond(objectMapper, System.out, response);
    }
}
