package com.axlabs.neo.sharesgov;

import io.neow3j.types.Hash160;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Reads the engine configuration from a properties file on the classpath. The file contains the operators in the
 * following format:
 * <pre>
 *  operator1=NM7Aky765FG8NhhwtxjXRx7jEL1cnw7PBP
 *  operator2=NZpsgXn9VQQoLexpuXJsrX8BsoyAhKUyiX
 *  ...
 * </pre>
 * And optionally values for the parameters in {@link GovernanceParameters}, keyed by the parameter keys.
 */
public class Config {

    public static final String PROPS_FILE = "sharesgov.properties";

    private final Properties props;

    private Config(Properties props) {
        this.props = props;
    }

    public static Config load() {
        return load(PROPS_FILE);
    }

    public static Config load(String resource) {
        Properties props = new Properties();
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Config file " + resource + " not found on the classpath");
            }
            props.load(in);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
        return new Config(props);
    }

    public String getProperty(String name) {
        String value = props.getProperty(name);
        return value == null ? null : value.trim();
    }

    public int getIntProperty(String name) {
        return Integer.parseInt(getProperty(name));
    }

    /**
     * @return the script hashes of the configured operators.
     */
    public List<Hash160> getOperators() {
        List<Hash160> operators = new ArrayList<>();
        int i = 1;
        String val = getProperty("operator" + i++);
        while (val != null) {
            operators.add(Hash160.fromAddress(val));
            val = getProperty("operator" + i++);
        }
        return operators;
    }

    /**
     * @return the default parameters overridden by the values present in the config.
     */
    public GovernanceParameters getParameters() {
        GovernanceParameters params = GovernanceParameters.defaults();
        for (String key : params.asMap().keySet()) {
            if (getProperty(key) != null) {
                params.put(key, getIntProperty(key), "config");
            }
        }
        return params;
    }
}
