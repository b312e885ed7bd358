package edu.yu.pagetable.config;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Properties;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import edu.yu.pagetable.hash.ExtendibleHashTable;

public class DBConfigurationTest {

    @BeforeEach
    @AfterEach
    public void restoreDefaults() {
        DBConfiguration.INSTANCE.get().setConfiguration(new Properties());
    }

    @Test
    public void defaults_come_from_classpath() {
        assertTrue(DBConfiguration.INSTANCE.isDBStartup());
        assertEquals(10, DBConfiguration.INSTANCE.bucketCapacity());
        assertEquals(30, DBConfiguration.INSTANCE.maxGlobalDepth());
    }

    @Test
    public void supplied_properties_override_defaults() {
        Properties props = new Properties();
        props.setProperty(DBConfiguration.DB_STARTUP, String.valueOf(false));
        props.setProperty(DBConfiguration.BUCKET_CAPACITY, "4");
        DBConfiguration.INSTANCE.get().setConfiguration(props);

        assertFalse(DBConfiguration.INSTANCE.isDBStartup());
        assertEquals(4, DBConfiguration.INSTANCE.bucketCapacity());
        // not supplied, so still the default
        assertEquals(30, DBConfiguration.INSTANCE.maxGlobalDepth());
    }

    @Test
    public void invalid_values_are_rejected_on_access() {
        Properties props = new Properties();
        props.setProperty(DBConfiguration.DB_STARTUP, "maybe");
        props.setProperty(DBConfiguration.BUCKET_CAPACITY, "0");
        props.setProperty(DBConfiguration.MAX_GLOBAL_DEPTH, "deep");
        DBConfiguration.INSTANCE.get().setConfiguration(props);

        assertThrows(IllegalStateException.class, () -> DBConfiguration.INSTANCE.isDBStartup());
        assertThrows(IllegalStateException.class, () -> DBConfiguration.INSTANCE.bucketCapacity());
        assertThrows(IllegalStateException.class, () -> DBConfiguration.INSTANCE.maxGlobalDepth());
    }

    @Test
    public void max_global_depth_must_fit_the_directory() {
        Properties props = new Properties();
        props.setProperty(DBConfiguration.MAX_GLOBAL_DEPTH, "31");
        DBConfiguration.INSTANCE.get().setConfiguration(props);
        assertThrows(IllegalStateException.class, () -> DBConfiguration.INSTANCE.maxGlobalDepth());

        props.setProperty(DBConfiguration.MAX_GLOBAL_DEPTH, "-1");
        DBConfiguration.INSTANCE.get().setConfiguration(props);
        assertThrows(IllegalStateException.class, () -> DBConfiguration.INSTANCE.maxGlobalDepth());

        // a single-slot directory is a legal configuration
        props.setProperty(DBConfiguration.MAX_GLOBAL_DEPTH, "0");
        DBConfiguration.INSTANCE.get().setConfiguration(props);
        assertEquals(0, DBConfiguration.INSTANCE.maxGlobalDepth());

        props.setProperty(DBConfiguration.MAX_GLOBAL_DEPTH, String.valueOf(ExtendibleHashTable.MAX_DEPTH_LIMIT));
        DBConfiguration.INSTANCE.get().setConfiguration(props);
        assertEquals(ExtendibleHashTable.MAX_DEPTH_LIMIT, DBConfiguration.INSTANCE.maxGlobalDepth());
    }

    @Test
    public void null_configuration() {
        assertThrows(IllegalArgumentException.class, () -> DBConfiguration.INSTANCE.get().setConfiguration(null));
    }

}
