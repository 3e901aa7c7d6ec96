package com.barometer.core.provider;

/**
 * Failure of an external command, file read or HTTP call while gathering a measurement.
 * Providers catch it and turn the message into a {@link com.barometer.core.model.Result.Failure}.
 */
public class ProviderException extends Exception {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
