package edu.mcmaster.braggfit;

/**
 * Missing or malformed instrument constants or integration settings.
 * Fatal for the whole run, not just one peak.
 */
public class ConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
