/**
 * Main application class for the research engine
 *
 * @author William Callahan
 *
 * Features:
 * - Loads a local .env file into system properties before Spring starts
 * - Enables async job execution
 * - Entry point for Spring Boot application
 */

package com.williamcallahan.research_engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

@SpringBootApplication
@EnableAsync
public class ResearchEngineApplication {

    private static final Logger log = LoggerFactory.getLogger(ResearchEngineApplication.class);

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        loadDotEnvFile(Paths.get(".env"));
        SpringApplication.run(ResearchEngineApplication.class, args);
    }

    /**
     * Copies entries of a .env file into system properties unless the environment already defines them
     */
    static void loadDotEnvFile(Path envFile) {
        if (!Files.exists(envFile)) {
            return;
        }
        Properties props = new Properties();
        try (InputStream is = Files.newInputStream(envFile)) {
            props.load(is);
        } catch (IOException | SecurityException e) {
            log.warn("Could not read {}: {}", envFile, e.getMessage());
            return;
        }
        for (String key : props.stringPropertyNames()) {
            if (System.getenv(key) == null && System.getProperty(key) == null) {
                System.setProperty(key, props.getProperty(key));
            }
        }
    }
}
