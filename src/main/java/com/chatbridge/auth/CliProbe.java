package com.chatbridge.auth;

import lombok.Value;

/**
 * Out-of-band check that the backend command-line tool is installed and answers.
 */
public interface CliProbe {

    ProbeResult probe();

    @Value
    class ProbeResult {
        boolean available;
        String version;
        String error;

        public static ProbeResult ok(String version) {
            return new ProbeResult(true, version, null);
        }

        public static ProbeResult failed(String error) {
            return new ProbeResult(false, null, error);
        }
    }
}
