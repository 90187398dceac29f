package com.chatbridge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Central application properties for the chat completions gateway.
 *
 * <p>Groups backend process settings, session retention, streaming limits, the advertised
 * model catalogue and authentication enforcement under the {@code bridge} prefix.</p>
 */
@Data
@ConfigurationProperties(prefix = "bridge")
public class BridgeProperties {

    private Backend backend = new Backend();
    private Session session = new Session();
    private Streaming streaming = new Streaming();
    private Models models = new Models();
    private Auth auth = new Auth();

    @Data
    public static class Backend {
        private String cliPath = "claude";
        private String defaultModel = "claude-sonnet-4-20250514";
        private String workingDirectory;
        private long probeTimeoutMs = 5_000;
        private long requestTimeoutMs = 600_000;
    }

    @Data
    public static class Session {
        private long ttlMinutes = 60;
        private long cleanupIntervalMs = 300_000;
        private int maxSessions = 10_000;
    }

    @Data
    public static class Streaming {
        /**
         * Longest backend silence, while a line is wanted, before the stream finishes with {@code length}.
         */
        private long idleTimeoutMs = 120_000;
        private int channelCapacity = 32;
    }

    @Data
    public static class Models {
        private List<String> supported = new ArrayList<>(List.of(
                "claude-sonnet-4-20250514",
                "claude-opus-4-20250514",
                "claude-3-7-sonnet-20250219",
                "claude-3-5-sonnet-20241022",
                "claude-3-5-haiku-20241022"
        ));
    }

    @Data
    public static class Auth {
        private boolean required = true;
    }
}
