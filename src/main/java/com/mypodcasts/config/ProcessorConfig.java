package com.mypodcasts.config;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Processor configuration.
 *
 * <p>This class provides type safe access to the settings of the command line processor.
 * <p>Example <i>processor.json5</i>:
 * <pre>
 * {
 *   outputDir: "emails",
 *   redirect: {
 *     timeout: 10,
 *     userAgent: "mypodcasts"
 *   }
 * }
 * </pre>
 */
public class ProcessorConfig extends ConfigFoundation {

    /**
     * Constructs a new ProcessorConfig instance with defaults.
     */
    public ProcessorConfig() {
        super();
    }

    /**
     * Constructs a new ProcessorConfig instance.
     *
     * @param map Configuration map.
     */
    public ProcessorConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ProcessorConfig instance from file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ProcessorConfig(Path path) throws IOException {
        super(path);
    }

    /**
     * Gets directory text files are written to.
     *
     * @return Path instance.
     */
    public Path getOutputDir() {
        return Paths.get(getStringProperty("outputDir", "emails"));
    }

    /**
     * Gets redirect resolution timeout in seconds.
     *
     * @return Timeout seconds.
     */
    public int getRedirectTimeout() {
        return Math.toIntExact(getLongProperty("redirect.timeout", 10L));
    }

    /**
     * Gets User-Agent sent when resolving redirects.
     *
     * @return User agent string.
     */
    public String getUserAgent() {
        return getStringProperty("redirect.userAgent", "mypodcasts");
    }
}
