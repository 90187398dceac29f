package com.chatbridge.auth;

import com.chatbridge.config.BridgeProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@code <cli> --version} and treats a zero exit within the probe timeout as a working install.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProcessCliProbe implements CliProbe {

    private final BridgeProperties properties;

    @Override
    public ProbeResult probe() {
        String cliPath = properties.getBackend().getCliPath();
        long timeoutMs = properties.getBackend().getProbeTimeoutMs();
        log.debug("Probing backend CLI path={} timeoutMs={}", cliPath, timeoutMs);
        Process process;
        try {
            process = new ProcessBuilder(cliPath, "--version")
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException ex) {
            log.debug("Backend CLI could not be started path={}", cliPath, ex);
            return ProbeResult.failed("Claude CLI not found at '" + cliPath + "'");
        }

        StringBuilder output = new StringBuilder();
        Thread reader = new Thread(() -> {
            try (BufferedReader in = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = in.readLine()) != null) {
                    output.append(line).append('\n');
                }
            } catch (IOException ex) {
                log.trace("Probe output stream closed early", ex);
            }
        }, "cli-probe-reader");
        reader.setDaemon(true);
        reader.start();

        try {
            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                return ProbeResult.failed("Claude CLI did not answer within " + timeoutMs + " ms");
            }
            reader.join(1_000);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return ProbeResult.failed("Claude CLI probe interrupted");
        }

        String version = output.toString().trim();
        if (process.exitValue() != 0) {
            log.debug("Backend CLI probe exited with code={} output='{}'", process.exitValue(), version);
            return ProbeResult.failed("Claude CLI exited with code " + process.exitValue());
        }
        log.debug("Backend CLI probe succeeded version='{}'", version);
        return ProbeResult.ok(version);
    }
}
