package com.sensorstats.cache;

/**
 * A start or end bound could not be parsed. The query is rejected; nothing is cached.
 */
public class InvalidDateException extends IllegalArgumentException {

    private final String parameter;
    private final String rawValue;

    public InvalidDateException(String parameter, String rawValue, Throwable cause) {
        super("Invalid " + parameter + " format. Use ISO format (YYYY-MM-DD or YYYY-MM-DDTHH:MM:SS).", cause);
        this.parameter = parameter;
        this.rawValue = rawValue;
    }

    public String getParameter() {
        return parameter;
    }

    public String getRawValue() {
        return rawValue;
    }
}
