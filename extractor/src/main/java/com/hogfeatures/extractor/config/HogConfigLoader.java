package com.hogfeatures.extractor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads {@link HogParameters} from JSON.
 *
 * Resource lookup order:
 * 1. the classpath resource named by the {@code hog.config.resource} system property
 * 2. {@code /hog_config.json} on the classpath
 * 3. {@link HogParameters#defaults()}
 */
public class HogConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(HogConfigLoader.class);

    public static final String RESOURCE_PROPERTY = "hog.config.resource";
    public static final String DEFAULT_RESOURCE = "/hog_config.json";

    private static final ObjectMapper mapper = new ObjectMapper();

    public static String resolveResourceName() {
        String sysProp = System.getProperty(RESOURCE_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp.startsWith("/") ? sysProp : "/" + sysProp;
        }
        return DEFAULT_RESOURCE;
    }

    public static HogParameters loadOrDefault() {
        return loadOrDefault(resolveResourceName());
    }

    /**
     * Reads the named classpath resource. A missing or unreadable resource falls
     * back to the defaults.
     */
    public static HogParameters loadOrDefault(String resourceName) {
        try (InputStream is = HogConfigLoader.class.getResourceAsStream(resourceName)) {
            if (is == null) {
                logger.warn("HOG config resource {} not found, using defaults", resourceName);
                return HogParameters.defaults();
            }
            HogParameters params = read(is);
            logger.info("Loaded HOG config from {}: {}", resourceName, params);
            return params;
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to load HOG config from {}, using defaults. Error: {}", resourceName,
                    e.getMessage());
            return HogParameters.defaults();
        }
    }

    /**
     * Parses parameters from a JSON stream. Fields absent from the JSON keep
     * their defaults.
     */
    public static HogParameters read(InputStream jsonStream) {
        try {
            HogParameters params = mapper.readValue(jsonStream, HogParameters.class);
            if (params == null) {
                throw new IOException("empty config document");
            }
            return params;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read HOG config from JSON", e);
        }
    }
}
