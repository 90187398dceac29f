package com.chatbridge.auth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AuthResolverTests {

    private final Map<String, String> env = new HashMap<>();
    private CliProbe cliProbe;
    private AuthResolver resolver;

    @BeforeEach
    void setUp() {
        cliProbe = Mockito.mock(CliProbe.class);
        when(cliProbe.probe()).thenReturn(CliProbe.ProbeResult.failed("Claude CLI not found at 'claude'"));
        resolver = new AuthResolver(() -> Map.copyOf(env), cliProbe,
                Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void bedrockFlagTakesPriorityOverApiKey() {
        env.put("CLAUDE_CODE_USE_BEDROCK", "1");
        env.put("AWS_ACCESS_KEY_ID", "AKIAEXAMPLEKEY123456");
        env.put("AWS_SECRET_ACCESS_KEY", "secret");
        env.put("AWS_REGION", "us-east-1");
        env.put("ANTHROPIC_API_KEY", "sk-ant-REDACTED");

        AuthStatus status = resolver.detect();

        assertThat(status.getMethod()).isEqualTo(AuthMethod.BEDROCK);
        assertThat(status.isValid()).isTrue();
        assertThat(status.getErrors()).isEmpty();
        assertThat(status.getConfig()).containsEntry("region", "us-east-1");
        assertThat(status.getEnvironmentVariablesPresent())
                .contains("CLAUDE_CODE_USE_BEDROCK", "AWS_ACCESS_KEY_ID", "ANTHROPIC_API_KEY");
    }

    @Test
    void bedrockWithMalformedKeyStaysSelectedButInvalid() {
        env.put("CLAUDE_CODE_USE_BEDROCK", "1");
        env.put("AWS_ACCESS_KEY_ID", "not-a-key");
        env.put("AWS_REGION", "eu-west-1");

        AuthStatus status = resolver.detect();

        assertThat(status.getMethod()).isEqualTo(AuthMethod.BEDROCK);
        assertThat(status.isValid()).isFalse();
        assertThat(status.getErrors())
                .anySatisfy(error -> assertThat(error).contains("AWS_ACCESS_KEY_ID"))
                .anySatisfy(error -> assertThat(error).contains("AWS_SECRET_ACCESS_KEY"));
    }

    @Test
    void vertexNeedsExistingCredentialFileAndProject(@TempDir Path dir) throws Exception {
        Path credentials = Files.writeString(dir.resolve("sa.json"), "{}");
        env.put("CLAUDE_CODE_USE_VERTEX", "1");
        env.put("GOOGLE_APPLICATION_CREDENTIALS", credentials.toString());
        env.put("GCLOUD_PROJECT", "demo-project");

        AuthStatus status = resolver.detect();

        assertThat(status.getMethod()).isEqualTo(AuthMethod.VERTEX);
        assertThat(status.isValid()).isTrue();
        assertThat(status.getConfig()).containsEntry("project", "demo-project");
    }

    @Test
    void vertexWithMissingCredentialFileIsInvalid(@TempDir Path dir) {
        env.put("CLAUDE_CODE_USE_VERTEX", "1");
        env.put("GOOGLE_APPLICATION_CREDENTIALS", dir.resolve("missing.json").toString());
        env.put("GOOGLE_CLOUD_PROJECT", "demo-project");

        AuthStatus status = resolver.detect();

        assertThat(status.getMethod()).isEqualTo(AuthMethod.VERTEX);
        assertThat(status.isValid()).isFalse();
        assertThat(status.getErrors()).containsExactly("vertex: credentials file not found");
    }

    @Test
    void apiKeyIsValidatedWithoutLeakingIt() {
        String key = "sk-ant-REDACTED";
        env.put("ANTHROPIC_API_KEY", key);

        AuthStatus status = resolver.detect();

        assertThat(status.getMethod()).isEqualTo(AuthMethod.ANTHROPIC);
        assertThat(status.isValid()).isTrue();
        assertThat(status.getConfig().values()).noneMatch(value -> String.valueOf(value).contains("sk-ant"));
        assertThat(status.toString()).doesNotContain(key);
    }

    @Test
    void shortApiKeyIsSelectedButInvalid() {
        env.put("ANTHROPIC_API_KEY", "sk-ant-short");

        AuthStatus status = resolver.detect();

        assertThat(status.getMethod()).isEqualTo(AuthMethod.ANTHROPIC);
        assertThat(status.isValid()).isFalse();
        assertThat(status.getErrors()).containsExactly("anthropic: ANTHROPIC_API_KEY is too short");
    }

    @Test
    void malformedApiKeyFallsBackToCli() {
        env.put("ANTHROPIC_API_KEY", "openai-style-key-1234567890");
        when(cliProbe.probe()).thenReturn(CliProbe.ProbeResult.ok("1.0.51 (Claude Code)"));

        AuthStatus status = resolver.detect();

        assertThat(status.getMethod()).isEqualTo(AuthMethod.CLI);
        assertThat(status.isValid()).isTrue();
        assertThat(status.getErrors()).hasSize(1);
        assertThat(status.getErrors().get(0)).startsWith("anthropic:");
        assertThat(status.getConfig()).containsEntry("cli_version", "1.0.51 (Claude Code)");
    }

    @Test
    void missingCliIsRecordedAsErrorInsteadOfThrowing() {
        AuthStatus status = resolver.detect();

        assertThat(status.getMethod()).isEqualTo(AuthMethod.NONE);
        assertThat(status.isValid()).isFalse();
        assertThat(status.getErrors()).containsExactly("cli: Claude CLI not found at 'claude'");
    }

    @Test
    void probeExceptionDoesNotEscape() {
        when(cliProbe.probe()).thenThrow(new IllegalStateException("boom"));

        AuthStatus status = resolver.detect();

        assertThat(status.getMethod()).isEqualTo(AuthMethod.NONE);
        assertThat(status.getErrors()).hasSize(1);
    }

    @Test
    void detectIsCachedUntilInvalidated() {
        assertThat(resolver.getCachedStatus()).isEmpty();

        AuthStatus first = resolver.detect();
        AuthStatus second = resolver.detect();

        assertThat(second).isSameAs(first);
        assertThat(resolver.getCachedStatus()).contains(first);
        verify(cliProbe, times(1)).probe();

        resolver.invalidate();
        assertThat(resolver.getCachedStatus()).isEmpty();
        AuthStatus third = resolver.detect();

        assertThat(third).isEqualTo(first);
        verify(cliProbe, times(2)).probe();
    }

    @Test
    void detectionIsDeterministicForSameEnvironmentApartFromTimestamp() {
        env.put("ANTHROPIC_API_KEY", "sk-ant-REDACTED");
        AuthResolver other = new AuthResolver(() -> Map.copyOf(env), cliProbe, Clock.systemUTC());

        AuthStatus a = resolver.detect();
        AuthStatus b = other.detect();

        assertThat(a.getCheckedAt()).isNotEqualTo(b.getCheckedAt());
        assertThat(a).isEqualTo(b);
    }

    @Test
    void backendEnvironmentForwardsMethodFlag() {
        env.put("CLAUDE_CODE_USE_BEDROCK", "1");
        env.put("AWS_ACCESS_KEY_ID", "ASIAEXAMPLEKEY123456");
        env.put("AWS_SECRET_ACCESS_KEY", "secret");
        env.put("AWS_REGION", "us-west-2");

        Map<String, String> forwarded = resolver.backendEnvironment();

        assertThat(forwarded)
                .containsEntry("CLAUDE_CODE_USE_BEDROCK", "1")
                .containsEntry("AWS_REGION", "us-west-2")
                .doesNotContainKey("ANTHROPIC_API_KEY");
    }
}
