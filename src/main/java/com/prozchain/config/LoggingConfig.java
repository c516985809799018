package com.prozchain.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.java.Log;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;

/**
 * Loads {@code logging.properties} from the classpath into the JUL {@link LogManager}.
 */
@Log
@Component
public class LoggingConfig {

    static final String LOGGING_PROPERTIES = "logging.properties";

    @PostConstruct
    public void configure() {
        try (InputStream config = LoggingConfig.class.getClassLoader().getResourceAsStream(LOGGING_PROPERTIES)) {
            if (config == null) {
                log.fine("No " + LOGGING_PROPERTIES + " on the classpath, keeping JUL defaults");
                return;
            }
            LogManager.getLogManager().readConfiguration(config);
        } catch (IOException e) {
            log.log(Level.WARNING, "Could not read " + LOGGING_PROPERTIES, e);
        }
    }
}
