package com.manifoldplatform.common.exception;

/**
 * Unsupported timescale tag, out-of-range sensitivity or an unusable
 * window / threshold value.
 */
public class InvalidConfigurationException extends ManifoldException {

    public InvalidConfigurationException(String setting, String message) {
        super(setting, message);
    }
}
