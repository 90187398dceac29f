package com.chatbridge.auth;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Resolves which credential mechanism authorizes backend calls.
 *
 * <p>Strategies are tried in a fixed order: Bedrock flag with AWS keys, Vertex flag with a
 * service-account file, a direct Anthropic API key, then the CLI's own login verified by a version
 * probe. The first strategy whose inputs are present decides {@link AuthStatus#getMethod()}; deeper
 * checks only affect {@link AuthStatus#isValid()} and the error list.</p>
 *
 * <p>The last status is cached. Reads never lock; detection and invalidation serialize on a single lock.</p>
 */
@Service
@Slf4j
public class AuthResolver {

    static final String USE_BEDROCK = "CLAUDE_CODE_USE_BEDROCK";
    static final String USE_VERTEX = "CLAUDE_CODE_USE_VERTEX";
    static final String ANTHROPIC_API_KEY = "ANTHROPIC_API_KEY";
    static final String AWS_ACCESS_KEY_ID = "AWS_ACCESS_KEY_ID";
    static final String AWS_SECRET_ACCESS_KEY = "AWS_SECRET_ACCESS_KEY";
    static final String AWS_REGION = "AWS_REGION";
    static final String GOOGLE_APPLICATION_CREDENTIALS = "GOOGLE_APPLICATION_CREDENTIALS";
    static final String GOOGLE_CLOUD_PROJECT = "GOOGLE_CLOUD_PROJECT";
    static final String GCLOUD_PROJECT = "GCLOUD_PROJECT";
    static final String CLOUD_ML_REGION = "CLOUD_ML_REGION";

    private static final String ANTHROPIC_KEY_PREFIX = "sk-ant-";
    private static final int MIN_API_KEY_LENGTH = 20;

    private static final List<String> REPORTED_VARIABLES = List.of(
            ANTHROPIC_API_KEY,
            USE_BEDROCK,
            USE_VERTEX,
            AWS_ACCESS_KEY_ID,
            AWS_SECRET_ACCESS_KEY,
            AWS_REGION,
            "AWS_PROFILE",
            GOOGLE_APPLICATION_CREDENTIALS,
            GOOGLE_CLOUD_PROJECT,
            GCLOUD_PROJECT,
            CLOUD_ML_REGION
    );

    private final EnvironmentSource environment;
    private final CliProbe cliProbe;
    private final Clock clock;

    private final AtomicReference<AuthStatus> cached = new AtomicReference<>();
    private final ReentrantLock detectionLock = new ReentrantLock();

    public AuthResolver(EnvironmentSource environment, CliProbe cliProbe, Clock clock) {
        this.environment = environment;
        this.cliProbe = cliProbe;
        this.clock = clock;
    }

    /**
     * Returns the cached status, running detection first when nothing is cached. Never throws.
     */
    public AuthStatus detect() {
        AuthStatus current = cached.get();
        if (current != null) {
            return current;
        }
        detectionLock.lock();
        try {
            current = cached.get();
            if (current == null) {
                current = runDetection();
                cached.set(current);
                log.info("Backend authentication resolved method={} valid={} errors={}",
                        current.getMethod().wireName(), current.isValid(), current.getErrors());
            }
            return current;
        } finally {
            detectionLock.unlock();
        }
    }

    public Optional<AuthStatus> getCachedStatus() {
        return Optional.ofNullable(cached.get());
    }

    public void invalidate() {
        detectionLock.lock();
        try {
            cached.set(null);
            log.debug("Authentication status invalidated");
        } finally {
            detectionLock.unlock();
        }
    }

    public Map<String, String> backendEnvironment() {
        AuthStatus status = detect();
        Map<String, String> env = environment.snapshot();
        Map<String, String> forwarded = new LinkedHashMap<>();
        switch (status.getMethod()) {
            case BEDROCK -> {
                forwarded.put(USE_BEDROCK, "1");
                copyIfPresent(env, forwarded, AWS_ACCESS_KEY_ID, AWS_SECRET_ACCESS_KEY, AWS_REGION, "AWS_SESSION_TOKEN");
            }
            case VERTEX -> {
                forwarded.put(USE_VERTEX, "1");
                copyIfPresent(env, forwarded, GOOGLE_APPLICATION_CREDENTIALS, GOOGLE_CLOUD_PROJECT, GCLOUD_PROJECT,
                        CLOUD_ML_REGION);
            }
            case ANTHROPIC -> copyIfPresent(env, forwarded, ANTHROPIC_API_KEY);
            default -> {
                // cli login lives in the CLI's own config
            }
        }
        return forwarded;
    }

    private AuthStatus runDetection() {
        Map<String, String> env = environment.snapshot();
        AuthStatus.AuthStatusBuilder status = AuthStatus.builder().checkedAt(clock.instant());
        REPORTED_VARIABLES.stream()
                .filter(name -> StringUtils.hasText(env.get(name)))
                .forEach(status::environmentVariablePresent);

        if ("1".equals(env.get(USE_BEDROCK))) {
            return checkBedrock(env, status);
        }
        if ("1".equals(env.get(USE_VERTEX))) {
            return checkVertex(env, status);
        }

        String apiKey = env.get(ANTHROPIC_API_KEY);
        if (StringUtils.hasText(apiKey)) {
            if (apiKey.startsWith(ANTHROPIC_KEY_PREFIX)) {
                return checkApiKey(apiKey, status);
            }
            status.error("anthropic: ANTHROPIC_API_KEY does not start with '" + ANTHROPIC_KEY_PREFIX + "'");
        }
        return checkCli(status);
    }

    private AuthStatus checkBedrock(Map<String, String> env, AuthStatus.AuthStatusBuilder status) {
        List<String> errors = new ArrayList<>();
        String accessKey = env.get(AWS_ACCESS_KEY_ID);
        if (!StringUtils.hasText(accessKey)) {
            errors.add("bedrock: " + AWS_ACCESS_KEY_ID + " is not set");
        } else if (!accessKey.startsWith("AKIA") && !accessKey.startsWith("ASIA")) {
            errors.add("bedrock: " + AWS_ACCESS_KEY_ID + " has an unexpected format");
        }
        if (!StringUtils.hasText(env.get(AWS_SECRET_ACCESS_KEY))) {
            errors.add("bedrock: " + AWS_SECRET_ACCESS_KEY + " is not set");
        }
        String region = env.get(AWS_REGION);
        if (!StringUtils.hasText(region)) {
            errors.add("bedrock: " + AWS_REGION + " is not set");
        } else {
            status.configEntry("region", region);
        }
        return status.method(AuthMethod.BEDROCK)
                .valid(errors.isEmpty())
                .errors(errors)
                .build();
    }

    private AuthStatus checkVertex(Map<String, String> env, AuthStatus.AuthStatusBuilder status) {
        List<String> errors = new ArrayList<>();
        String credentials = env.get(GOOGLE_APPLICATION_CREDENTIALS);
        if (!StringUtils.hasText(credentials)) {
            errors.add("vertex: " + GOOGLE_APPLICATION_CREDENTIALS + " is not set");
        } else if (!credentialFileExists(credentials)) {
            errors.add("vertex: credentials file not found");
        } else {
            status.configEntry("credentials_file", credentials);
        }
        String project = StringUtils.hasText(env.get(GOOGLE_CLOUD_PROJECT))
                ? env.get(GOOGLE_CLOUD_PROJECT)
                : env.get(GCLOUD_PROJECT);
        if (!StringUtils.hasText(project)) {
            errors.add("vertex: " + GOOGLE_CLOUD_PROJECT + " or " + GCLOUD_PROJECT + " is not set");
        } else {
            status.configEntry("project", project);
        }
        if (StringUtils.hasText(env.get(CLOUD_ML_REGION))) {
            status.configEntry("region", env.get(CLOUD_ML_REGION));
        }
        return status.method(AuthMethod.VERTEX)
                .valid(errors.isEmpty())
                .errors(errors)
                .build();
    }

    private AuthStatus checkApiKey(String apiKey, AuthStatus.AuthStatusBuilder status) {
        status.configEntry("api_key_present", true);
        if (apiKey.length() < MIN_API_KEY_LENGTH) {
            return status.method(AuthMethod.ANTHROPIC)
                    .valid(false)
                    .error("anthropic: ANTHROPIC_API_KEY is too short")
                    .build();
        }
        return status.method(AuthMethod.ANTHROPIC).valid(true).build();
    }

    private AuthStatus checkCli(AuthStatus.AuthStatusBuilder status) {
        CliProbe.ProbeResult probe;
        try {
            probe = cliProbe.probe();
        } catch (RuntimeException ex) {
            log.warn("CLI probe failed unexpectedly", ex);
            probe = CliProbe.ProbeResult.failed("CLI probe failed: " + ex.getClass().getSimpleName());
        }
        if (probe.isAvailable()) {
            return status.method(AuthMethod.CLI)
                    .valid(true)
                    .configEntry("cli_version", probe.getVersion() == null ? "" : probe.getVersion())
                    .build();
        }
        return status.method(AuthMethod.NONE)
                .valid(false)
                .error("cli: " + probe.getError())
                .build();
    }

    private static boolean credentialFileExists(String location) {
        try {
            return Files.isRegularFile(Path.of(location));
        } catch (InvalidPathException ex) {
            return false;
        }
    }

    private static void copyIfPresent(Map<String, String> from, Map<String, String> to, String... names) {
        for (String name : names) {
            String value = from.get(name);
            if (StringUtils.hasText(value)) {
                to.put(name, value);
            }
        }
    }
}
