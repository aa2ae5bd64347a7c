package im.arun.outline.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String CLASSPATH_CONFIG = "config.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final OutlineConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private OutlineConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled defaults
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), OutlineConfig.class);
                }
                logger.warn("Config file {} not found, falling back to bundled configuration", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(CLASSPATH_CONFIG)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, OutlineConfig.class);
                }
            }

            logger.warn("No config.yaml found, using default configuration");
            return new OutlineConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new OutlineConfig();
        }
    }

    public OutlineConfig load() {
        return load(null);
    }

    public OutlineConfig load(Map<String, Object> userOptions) {
        OutlineConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            switch (key) {
                case "max_lines":
                case "maxLines":
                    config.setMaxLines(parseInt(key, value));
                    break;
                case "min_group_size":
                case "minGroupSize":
                    config.setMinGroupSize(parseInt(key, value));
                    break;
                case "text_truncate_length":
                case "textTruncateLength":
                    config.setTextTruncateLength(parseInt(key, value));
                    break;
                case "max_refs_in_summary":
                case "maxRefsInSummary":
                    config.setMaxRefsInSummary(parseInt(key, value));
                    break;
                case "sample_children":
                case "sampleChildren":
                    config.setSampleChildren(parseInt(key, value));
                    break;
                case "similarity_threshold":
                case "similarityThreshold":
                    config.setSimilarityThreshold(parseInt(key, value));
                    break;
                case "boost_priority":
                case "boostPriority":
                    config.setBoostPriority(parseInt(key, value));
                    break;
                case "max_tokens":
                case "maxTokens":
                    config.setMaxTokens(parseInt(key, value));
                    break;
                case "apply_token_limit":
                case "applyTokenLimit":
                    config.setApplyTokenLimit(parseBoolean(value));
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        return config;
    }

    private int parseInt(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Configuration key " + key + " expects an integer: " + value, e);
            }
        }
        throw new IllegalArgumentException("Configuration key " + key + " expects an integer: " + value);
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private OutlineConfig copyConfig(OutlineConfig source) {
        OutlineConfig copy = new OutlineConfig();
        copy.setMaxLines(source.getMaxLines());
        copy.setMinGroupSize(source.getMinGroupSize());
        copy.setTextTruncateLength(source.getTextTruncateLength());
        copy.setMaxRefsInSummary(source.getMaxRefsInSummary());
        copy.setSampleChildren(source.getSampleChildren());
        copy.setSimilarityThreshold(source.getSimilarityThreshold());
        copy.setBoostPriority(source.getBoostPriority());
        copy.setMaxTokens(source.getMaxTokens());
        copy.setApplyTokenLimit(source.isApplyTokenLimit());
        return copy;
    }
}
