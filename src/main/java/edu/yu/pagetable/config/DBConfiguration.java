package edu.yu.pagetable.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import edu.yu.pagetable.hash.ExtendibleHashTable;

/**
 * Process-wide database settings. Defaults come from {@code dbms.properties} on
 * the classpath and may be replaced at any time through
 * {@link #setConfiguration(Properties)}.
 */
public enum DBConfiguration {

    INSTANCE;

    /** True iff the database directory should be wiped on startup. */
    public static final String DB_STARTUP = "DB_STARTUP";

    /** Number of entries a page-table bucket holds before it splits. */
    public static final String BUCKET_CAPACITY = "BUCKET_CAPACITY";

    /** Upper bound on the page-table's global depth. */
    public static final String MAX_GLOBAL_DEPTH = "MAX_GLOBAL_DEPTH";

    private static final String DEFAULTS_RESOURCE = "dbms.properties";

    private volatile Properties properties = loadDefaults();

    public DBConfiguration get() {
        return this;
    }

    /**
     * Replace the current settings. Keys missing from the supplied properties
     * fall back to the classpath defaults.
     * 
     * @param props
     */
    public void setConfiguration(Properties props) {
        if (props == null) {
            throw new IllegalArgumentException("Properties can't be null");
        }

        Properties merged = loadDefaults();
        merged.putAll(props);
        this.properties = merged;
    }

    public boolean isDBStartup() {
        String value = require(DB_STARTUP);
        if (!value.equalsIgnoreCase("true") && !value.equalsIgnoreCase("false")) {
            throw new IllegalStateException(DB_STARTUP + " must be true or false: " + value);
        }
        return Boolean.parseBoolean(value);
    }

    public int bucketCapacity() {
        int n = intValue(BUCKET_CAPACITY);
        if (n <= 0) {
            throw new IllegalStateException(BUCKET_CAPACITY + " must be positive: " + n);
        }
        return n;
    }

    /**
     * @return the configured depth, between 0 and
     *         {@link ExtendibleHashTable#MAX_DEPTH_LIMIT} inclusive
     */
    public int maxGlobalDepth() {
        int n = intValue(MAX_GLOBAL_DEPTH);
        if (n < 0 || n > ExtendibleHashTable.MAX_DEPTH_LIMIT) {
            throw new IllegalStateException(
                    MAX_GLOBAL_DEPTH + " must be between 0 and " + ExtendibleHashTable.MAX_DEPTH_LIMIT + ": " + n);
        }
        return n;
    }

    private int intValue(String key) {
        String value = require(key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " must be an integer: " + value, e);
        }
    }

    private String require(String key) {
        String value = this.properties.getProperty(key);
        if (value == null) {
            throw new IllegalStateException("No value configured for " + key);
        }
        return value.trim();
    }

    private static Properties loadDefaults() {
        Properties defaults = new Properties();
        try (InputStream in = DBConfiguration.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                defaults.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Couldn't load " + DEFAULTS_RESOURCE, e);
        }
        return defaults;
    }

}
