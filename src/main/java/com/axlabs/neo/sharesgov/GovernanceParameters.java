package com.axlabs.neo.sharesgov;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The tunable parameters of the engine, stored under their keys.
 */
public class GovernanceParameters {

    // Parameter keys
    public static final String MAX_OPTIONS_KEY = "max_options"; // int, options per proposal
    public static final String MAX_PAGE_SIZE_KEY = "max_page_size"; // int, proposals per page
    public static final String EVENT_HISTORY_KEY = "event_history"; // int, retained notifications

    static final int DEFAULT_MAX_OPTIONS = 16;
    static final int DEFAULT_MAX_PAGE_SIZE = 100;
    static final int DEFAULT_EVENT_HISTORY = 10_000;

    private final Map<String, Integer> parameters = new LinkedHashMap<>();

    /**
     * @return parameters holding the default values.
     */
    public static GovernanceParameters defaults() {
        GovernanceParameters p = new GovernanceParameters();
        p.parameters.put(MAX_OPTIONS_KEY, DEFAULT_MAX_OPTIONS);
        p.parameters.put(MAX_PAGE_SIZE_KEY, DEFAULT_MAX_PAGE_SIZE);
        p.parameters.put(EVENT_HISTORY_KEY, DEFAULT_EVENT_HISTORY);
        return p;
    }

    /**
     * Sets the value of a parameter after validating it.
     *
     * @param paramKey The parameter's key.
     * @param value    The new value.
     * @param method   The operation on whose behalf the value is set. Used in the error message.
     */
    public void put(String paramKey, int value, String method) {
        throwOnInvalidValue(paramKey, value, method);
        parameters.put(paramKey, value);
    }

    public int getInt(String paramKey) {
        Integer value = parameters.get(paramKey);
        if (value == null) {
            throw new GovernanceException(ErrorKind.NOT_FOUND, "getParameter", "Unknown parameter");
        }
        return value;
    }

    public Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    static void throwOnInvalidValue(String paramKey, int value, String method) {
        if (paramKey == null) {
            throw new GovernanceException(ErrorKind.INVALID_ARGUMENT, method, "Unknown parameter");
        }
        switch (paramKey) {
            case MAX_OPTIONS_KEY:
                if (value < 2 || value > 256) throwInvalidValue(method);
                break;
            case MAX_PAGE_SIZE_KEY:
                if (value < 1 || value > 1000) throwInvalidValue(method);
                break;
            case EVENT_HISTORY_KEY:
                if (value < 0 || value > 1_000_000) throwInvalidValue(method);
                break;
            default:
                throw new GovernanceException(ErrorKind.INVALID_ARGUMENT, method, "Unknown parameter");
        }
    }

    private static void throwInvalidValue(String method) {
        throw new GovernanceException(ErrorKind.INVALID_ARGUMENT, method, "Invalid parameter value");
    }
}
