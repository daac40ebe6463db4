package com.unlistedjobs.archetype;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Utility class for retries and configuration lookups shared by the batch and its adapters.
 *
 * @author Archetype Inference Team
 * @since 1.0
 */
public class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    private Utils() {}

    /**
     * Reads a setting from system properties first, then environment variables.
     * @param name Setting name, e.g. {@code REFERENCE_YEAR}
     * @param defaultValue Value when neither is set
     * @return Setting value
     */
    public static String envOrProp(String name, String defaultValue) {
        String value = System.getProperty(name);
        if (value == null || value.isBlank()) value = System.getenv(name);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    /**
     * Integer variant of {@link #envOrProp(String, String)}; unparsable values fall back to the default.
     */
    public static Integer envOrPropInt(String name, Integer defaultValue) {
        String value = envOrProp(name, null);
        if (value == null) return defaultValue;
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric {}={}", name, value);
            return defaultValue;
        }
    }

    /**
     * Retries an action up to maxAttempts times with exponential backoff.
     * @param action Callable action to execute
     * @param maxAttempts Maximum number of attempts
     * @param backoffMillis Delay before the second attempt; doubled after every further failure
     * @param actionDesc Description for logging
     * @param <T> Return type
     * @return Result of action, or null if all attempts fail or the thread is interrupted
     */
    public static <T> T retryAction(Callable<T> action, int maxAttempts, long backoffMillis, String actionDesc) {
        int attempts = 0;
        while (attempts < maxAttempts) {
            try {
                return action.call();
            } catch (Exception e) {
                attempts++;
                logger.warn("Failed {} (attempt {}/{}): {}", actionDesc, attempts, maxAttempts, e.getMessage());
                if (attempts >= maxAttempts) break;
                try {
                    Thread.sleep(backoffMillis * (1L << (attempts - 1)));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    logger.warn("Interrupted while retrying {}", actionDesc);
                    return null;
                }
            }
        }
        logger.error("Giving up on {} after {} attempts.", actionDesc, maxAttempts);
        return null;
    }
}
