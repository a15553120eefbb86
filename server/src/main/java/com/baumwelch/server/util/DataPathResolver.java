package com.baumwelch.server.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.InputStream;

public class DataPathResolver {
    private static final Logger logger = LoggerFactory.getLogger(DataPathResolver.class);

    public static final String DATA_DIR_PROPERTY = "hmm.data.dir";
    public static final String CONFIG_RESOURCE = "/hmm_config.json";

    public static String resolveDataDirectory() {
        // 1. Check System Property
        String sysProp = System.getProperty(DATA_DIR_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        // 2. Check Config File
        try {
            ObjectMapper mapper = new ObjectMapper();
            try (InputStream is = DataPathResolver.class.getResourceAsStream(CONFIG_RESOURCE)) {
                if (is != null) {
                    JsonNode root = mapper.readTree(is);
                    if (root.has("data_directory")) {
                        String configDir = root.get("data_directory").asText();
                        if (configDir != null && !configDir.isEmpty()) {
                            return configDir;
                        }
                    }
                }
            }
        } catch (Exception e) {
            logger.warn("Failed to read data_directory from config: {}", e.getMessage());
        }

        // 3. Default
        return ".";
    }

    public static String resolveDbPath() {
        return resolveDataDirectory() + File.separator + "hmm_runs.db";
    }
}
