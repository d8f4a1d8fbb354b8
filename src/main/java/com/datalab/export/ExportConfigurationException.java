package com.datalab.export;

/**
 * The requested export cannot run with the given options. Always raised before any output is written.
 */
public class ExportConfigurationException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public ExportConfigurationException(String message) {
        super(message);
    }
}
