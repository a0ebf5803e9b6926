package com.hooklight.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hooklight.core.git.GitInfoProvider;
import com.hooklight.core.git.GitInfoService;
import com.hooklight.core.process.CommandRunner;
import com.hooklight.core.process.ProcessCommandRunner;
import com.hooklight.core.state.HooksStateStore;
import com.hooklight.core.telemetry.TelemetryWriter;
import com.hooklight.core.testing.CommandTestRunner;
import com.hooklight.core.testing.ConventionTestDiscovery;
import com.hooklight.core.testing.TestDiscovery;
import com.hooklight.core.testing.TestRunner;
import com.hooklight.core.testing.TestVerifier;
import com.hooklight.core.transcript.TranscriptParser;
import com.hooklight.core.validation.OutputValidator;
import com.hooklight.core.validation.TypeChecker;
import com.hooklight.core.validation.TypeScriptTypeChecker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class HooklightConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * In-memory registry for one-shot hook processes; replaced when a real registry is on the
     * classpath.
     */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public CommandRunner commandRunner() {
        return new ProcessCommandRunner();
    }

    @Bean
    public GitInfoProvider gitInfoProvider(CommandRunner commandRunner, HooklightProperties properties) {
        return new GitInfoService(commandRunner, properties);
    }

    @Bean
    public TypeChecker typeChecker(CommandRunner commandRunner, HooklightProperties properties) {
        return new TypeScriptTypeChecker(commandRunner, properties);
    }

    @Bean
    public TestDiscovery testDiscovery() {
        return new ConventionTestDiscovery();
    }

    @Bean
    public TestRunner testRunner(CommandRunner commandRunner, HooklightProperties properties) {
        return new CommandTestRunner(commandRunner, properties);
    }

    @Bean
    public TranscriptParser transcriptParser(ObjectMapper objectMapper) {
        return new TranscriptParser(objectMapper);
    }

    @Bean
    public OutputValidator outputValidator(TranscriptParser transcriptParser, TypeChecker typeChecker,
                                           HooklightProperties properties) {
        return new OutputValidator(transcriptParser, typeChecker, properties);
    }

    @Bean
    public TestVerifier testVerifier(TestDiscovery testDiscovery, TestRunner testRunner) {
        return new TestVerifier(testDiscovery, testRunner);
    }

    @Bean
    public TelemetryWriter telemetryWriter(HooklightProperties properties, ObjectMapper objectMapper, Clock clock) {
        return new TelemetryWriter(properties, objectMapper, clock);
    }

    @Bean
    public HooksStateStore hooksStateStore(HooklightProperties properties, ObjectMapper objectMapper) {
        return new HooksStateStore(properties, objectMapper);
    }
}
