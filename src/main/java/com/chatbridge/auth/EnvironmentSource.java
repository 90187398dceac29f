package com.chatbridge.auth;

import java.util.Map;

@FunctionalInterface
public interface EnvironmentSource {

    Map<String, String> snapshot();
}
