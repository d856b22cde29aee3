package org.blackjacksim.exception;

/**
 * Invalid simulation configuration. Raised before any run is started.
 */
public class ConfigurationException extends SimulationException {
    public ConfigurationException(String message) {
        super(message);
    }
}
