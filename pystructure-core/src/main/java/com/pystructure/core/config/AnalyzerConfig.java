package com.pystructure.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration for PyStructure.
 *
 * <p>Loaded from {@code pystructure.yaml}. Every section is optional; missing sections and
 * missing keys fall back to the values of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * parser:
 *   pythonExecutable: "/usr/bin/python3.12"
 *   timeoutSeconds: 60
 *
 * output:
 *   pretty: false
 * }</pre>
 *
 * @param parser parser settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzerConfig(
    @JsonProperty("parser") ParserConfig parser,
    @JsonProperty("output") OutputConfig output
) {
    public AnalyzerConfig {
        parser = parser != null ? parser : ParserConfig.defaults();
        output = output != null ? output : OutputConfig.defaults();
    }

    /**
     * Creates the default configuration: {@code python3}, a 30 second parse timeout and
     * pretty-printed JSON.
     *
     * @return default configuration
     */
    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig(ParserConfig.defaults(), OutputConfig.defaults());
    }

    /**
     * External parser settings.
     *
     * @param pythonExecutable interpreter command used to dump syntax trees
     * @param timeoutSeconds maximum time allowed for one parse
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ParserConfig(
        @JsonProperty("pythonExecutable") String pythonExecutable,
        @JsonProperty("timeoutSeconds") Long timeoutSeconds
    ) {
        public static final String DEFAULT_PYTHON = "python3";
        public static final long DEFAULT_TIMEOUT_SECONDS = 30;

        public ParserConfig {
            if (pythonExecutable == null || pythonExecutable.isBlank()) {
                pythonExecutable = DEFAULT_PYTHON;
            }
            if (timeoutSeconds == null || timeoutSeconds <= 0) {
                timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
            }
        }

        public static ParserConfig defaults() {
            return new ParserConfig(DEFAULT_PYTHON, DEFAULT_TIMEOUT_SECONDS);
        }
    }

    /**
     * Report output settings.
     *
     * @param pretty whether JSON is indented
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("pretty") Boolean pretty
    ) {
        public OutputConfig {
            if (pretty == null) {
                pretty = Boolean.TRUE;
            }
        }

        public static OutputConfig defaults() {
            return new OutputConfig(Boolean.TRUE);
        }
    }
}
