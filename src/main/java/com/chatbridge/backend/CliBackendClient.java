package com.chatbridge.backend;

import com.chatbridge.auth.AuthResolver;
import com.chatbridge.config.BridgeProperties;
import com.chatbridge.exception.BackendInvocationException;
import com.chatbridge.tools.BackendToolConfig;
import com.chatbridge.translate.InvocationDescriptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the backend CLI once per request in print mode with line-delimited JSON output.
 * The prompt goes in on stdin; stderr is drained on a side thread and only ever logged.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CliBackendClient implements BackendClient {

    static final String MAX_THINKING_TOKENS_ENV = "MAX_THINKING_TOKENS";
    private static final int STDERR_TAIL_CHARS = 2_000;

    private final BridgeProperties properties;
    private final AuthResolver authResolver;

    @Override
    public Flux<String> stream(InvocationDescriptor descriptor) {
        return Flux.using(
                        () -> start(descriptor),
                        this::readLines,
                        this::release)
                .subscribeOn(Schedulers.boundedElastic())
                .doOnSubscribe(subscription -> log.debug("Invoking backend requestId={} model={}",
                        descriptor.getRequestId(), descriptor.getModel()))
                .doOnCancel(() -> log.debug("Backend invocation cancelled requestId={}", descriptor.getRequestId()));
    }

    List<String> buildCommand(InvocationDescriptor descriptor) {
        List<String> command = new ArrayList<>();
        command.add(properties.getBackend().getCliPath());
        command.add("--print");
        command.add("--output-format");
        command.add("stream-json");
        command.add("--verbose");
        if (descriptor.isStream()) {
            command.add("--include-partial-messages");
        }
        command.add("--model");
        command.add(descriptor.getModel());
        if (StringUtils.hasText(descriptor.getSystemPrompt())) {
            command.add("--system-prompt");
            command.add(descriptor.getSystemPrompt());
        }
        if (descriptor.getMaxTurns() != null) {
            command.add("--max-turns");
            command.add(String.valueOf(descriptor.getMaxTurns()));
        }
        BackendToolConfig tools = descriptor.getToolConfig();
        if (tools != null) {
            if (!tools.getAllowedTools().isEmpty()) {
                command.add("--allowedTools");
                command.add(String.join(",", tools.getAllowedTools()));
            }
            if (!tools.getDisallowedTools().isEmpty()) {
                command.add("--disallowedTools");
                command.add(String.join(",", tools.getDisallowedTools()));
            }
        }
        if (StringUtils.hasText(descriptor.getPermissionMode())) {
            command.add("--permission-mode");
            command.add(descriptor.getPermissionMode());
        }
        return command;
    }

    private RunningBackend start(InvocationDescriptor descriptor) {
        ProcessBuilder builder = new ProcessBuilder(buildCommand(descriptor));
        builder.environment().putAll(authResolver.backendEnvironment());
        if (descriptor.getMaxThinkingTokens() != null) {
            builder.environment().put(MAX_THINKING_TOKENS_ENV, String.valueOf(descriptor.getMaxThinkingTokens()));
        }
        String workingDirectory = properties.getBackend().getWorkingDirectory();
        if (StringUtils.hasText(workingDirectory)) {
            builder.directory(new File(workingDirectory));
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException ex) {
            throw new BackendInvocationException("Could not start backend CLI '"
                    + properties.getBackend().getCliPath() + "'", ex);
        }
        RunningBackend running = new RunningBackend(descriptor.getRequestId(), process);
        running.drainStderr();
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(descriptor.getPrompt().getBytes(StandardCharsets.UTF_8));
        } catch (IOException ex) {
            release(running);
            throw new BackendInvocationException("Could not send prompt to backend", ex);
        }
        log.debug("Backend process started requestId={} pid={}", descriptor.getRequestId(), process.pid());
        return running;
    }

    private Flux<String> readLines(RunningBackend running) {
        return Flux.generate(sink -> {
            try {
                String line = running.stdout.readLine();
                if (line != null) {
                    running.linesRead++;
                    sink.next(line);
                    return;
                }
                int exitCode = running.process.waitFor();
                if (exitCode != 0 && running.linesRead == 0) {
                    log.error("Backend exited requestId={} code={} stderr='{}'",
                            running.requestId, exitCode, running.stderrTail());
                    sink.error(new BackendInvocationException("Backend exited with code " + exitCode));
                    return;
                }
                if (exitCode != 0) {
                    log.warn("Backend exited requestId={} code={} after {} line(s) stderr='{}'",
                            running.requestId, exitCode, running.linesRead, running.stderrTail());
                }
                sink.complete();
            } catch (IOException ex) {
                sink.error(new BackendInvocationException("Failed reading backend output", ex));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                sink.error(new BackendInvocationException("Interrupted while waiting for backend", ex));
            }
        });
    }

    private void release(RunningBackend running) {
        if (running.process.isAlive()) {
            log.debug("Destroying backend process requestId={} pid={}", running.requestId, running.process.pid());
            running.process.destroyForcibly();
        }
        try {
            running.stdout.close();
        } catch (IOException ex) {
            log.trace("Closing backend stdout failed requestId={}", running.requestId, ex);
        }
    }

    private static final class RunningBackend {
        private final String requestId;
        private final Process process;
        private final BufferedReader stdout;
        private final StringBuffer stderr = new StringBuffer();
        private long linesRead;

        private RunningBackend(String requestId, Process process) {
            this.requestId = requestId;
            this.process = process;
            this.stdout = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
        }

        private void drainStderr() {
            Thread drainer = new Thread(() -> {
                try (BufferedReader reader = new BufferedReader(
                        new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                    String line;
                    while ((line = reader.readLine()) != null) {
                        stderr.append(line).append('\n');
                        if (stderr.length() > STDERR_TAIL_CHARS * 2) {
                            stderr.delete(0, stderr.length() - STDERR_TAIL_CHARS);
                        }
                    }
                } catch (IOException ex) {
                    log.trace("Backend stderr closed requestId={}", requestId, ex);
                }
            }, "backend-stderr-" + requestId);
            drainer.setDaemon(true);
            drainer.start();
        }

        private String stderrTail() {
            String text = stderr.toString().trim();
            return text.length() > STDERR_TAIL_CHARS ? text.substring(text.length() - STDERR_TAIL_CHARS) : text;
        }
    }
}
