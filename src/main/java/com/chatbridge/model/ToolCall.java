package com.chatbridge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {
    private String id;
    @Builder.Default
    private String type = "function";
    private Function function;

    public static ToolCall function(String id, String name, String argumentsJson) {
        return ToolCall.builder()
                .id(id)
                .function(new Function(name, argumentsJson == null ? "{}" : argumentsJson))
                .build();
    }

    @JsonIgnore
    public String getName() {
        return function != null ? function.getName() : null;
    }

    @JsonIgnore
    public String getArguments() {
        return function != null ? function.getArguments() : null;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Function {
        private String name;
        private String arguments;
    }
}
