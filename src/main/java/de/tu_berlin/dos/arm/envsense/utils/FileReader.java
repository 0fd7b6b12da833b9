package de.tu_berlin.dos.arm.envsense.utils;

import org.apache.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.Properties;

public enum FileReader { GET;

    private static final Logger LOG = Logger.getLogger(FileReader.class);

    /**
     * Loads a classpath resource as the requested type. {@code Properties} are loaded and then overlaid
     * with JVM system properties of the same key; {@code File} resolves the resource location.
     */
    public <T> T read(String fileName, Class<T> clazz) throws IOException {

        URL resource = FileReader.class.getClassLoader().getResource(fileName);
        if (resource == null) throw new IOException("Resource not found on classpath: " + fileName);

        if (clazz == Properties.class) {

            Properties props = new Properties();
            try (InputStream input = resource.openStream()) {

                props.load(input);
            }
            for (String key : props.stringPropertyNames()) {

                String override = System.getProperty(key);
                if (override != null) {

                    LOG.info("Property " + key + " overridden by system property");
                    props.setProperty(key, override);
                }
            }
            return clazz.cast(props);
        }
        else if (clazz == File.class) {

            try {
                return clazz.cast(new File(resource.toURI()));
            }
            catch (URISyntaxException e) {

                throw new IOException("Invalid resource location " + resource, e);
            }
        }
        throw new IllegalArgumentException("Unsupported resource type " + clazz.getName());
    }
}
