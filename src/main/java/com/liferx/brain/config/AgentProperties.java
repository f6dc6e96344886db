package com.liferx.brain.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Arrays;
import java.util.List;

/**
 * Strongly-typed configuration for the agent loop and its tool layer.
 * Bound from application.yml under the "agent" prefix.
 */
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    /** Name reported in the final payload's "agent" field */
    private String name = "Brain";

    /** Per-request cap on tool invocations */
    private int maxToolCalls = 5;

    /** Per-request cap on model calls */
    private int maxIterations = 10;

    /** Used when a request carries no org_id */
    private String defaultOrgId = "";

    /** Shared secret for the internal endpoints, empty rejects every call */
    private String internalSecret = "";

    /** SseEmitter timeout, 0 = never time out on the servlet side */
    private long streamTimeoutMs = 0;

    private Sanitizer sanitizer = new Sanitizer();

    @Data
    public static class Sanitizer {
        private int maxDepth = 10;
        private int maxStringLength = 500;
        private int maxNestedStringLength = 300;
        private int maxArrayItems = 10;

        /** Comma-separated, matched case-insensitively against the whole key */
        private String sensitiveKeys =
                "password,passwd,secret,token,api_key,apikey,access_token,refresh_token,"
                        + "authorization,credential,credentials,private_key,ssn";

        /** Comma-separated, matched case-insensitively anywhere inside the key */
        private String sensitiveKeyFragments =
                "password,secret,token,credential,api_key,apikey,private_key";

        public List<String> getSensitiveKeyList() {
            return split(sensitiveKeys);
        }

        public List<String> getSensitiveKeyFragmentList() {
            return split(sensitiveKeyFragments);
        }

        private static List<String> split(String csv) {
            if (csv == null || csv.isBlank()) return List.of();
            return Arrays.stream(csv.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isBlank())
                    .map(String::toLowerCase)
                    .toList();
        }
    }
}
