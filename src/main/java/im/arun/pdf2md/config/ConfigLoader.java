package im.arun.pdf2md.config;

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
import java.util.OptionalInt;

/**
 * Loads {@link ConverterConfig} from YAML and merges command-line overrides on top of it.
 * An explicit file wins over the bundled {@code config.yaml}; either one falls back to built-in defaults.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final ConverterConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private ConverterConfig loadDefaultConfig(String configPath) {
        try {
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), ConverterConfig.class);
                }
                logger.warn("Config file {} not found, falling back to bundled configuration", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream("config.yaml")) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, ConverterConfig.class);
                }
            }

            logger.warn("No config.yaml found, using default configuration");
            return new ConverterConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new ConverterConfig();
        }
    }

    public ConverterConfig load(Map<String, Object> userOptions) {
        ConverterConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            try {
                switch (key) {
                    case "short_text_threshold":
                    case "shortTextThreshold":
                        parsePositive(key, value).ifPresent(config::setShortTextThreshold);
                        break;
                    case "medium_text_threshold":
                    case "mediumTextThreshold":
                        parsePositive(key, value).ifPresent(config::setMediumTextThreshold);
                        break;
                    case "concurrency_limit":
                    case "concurrencyLimit":
                        parsePositive(key, value).ifPresent(config::setConcurrencyLimit);
                        break;
                    case "output_dir":
                    case "outputDir":
                        config.setOutputDir(value.toString());
                        break;
                    case "ocr_language":
                    case "ocrLanguage":
                        config.setOcrLanguage(value.toString());
                        break;
                    case "tessdata_path":
                    case "tessdataPath":
                        config.setTessdataPath(value.toString());
                        break;
                    case "document_title":
                    case "documentTitle":
                        config.setDocumentTitle(value.toString());
                        break;
                    case "end_marker":
                    case "endMarker":
                        config.setEndMarker(value.toString());
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            } catch (NumberFormatException e) {
                logger.error("Error setting config key {}: {}", key, e.getMessage());
            }
        });

        return config;
    }

    private OptionalInt parsePositive(String key, Object value) {
        int parsed = value instanceof Number ? ((Number) value).intValue() : Integer.parseInt(value.toString().trim());
        if (parsed <= 0) {
            logger.warn("Ignoring non-positive value {} for {}", parsed, key);
            return OptionalInt.empty();
        }
        return OptionalInt.of(parsed);
    }

    private ConverterConfig copyConfig(ConverterConfig source) {
        ConverterConfig copy = new ConverterConfig();
        copy.setShortTextThreshold(source.getShortTextThreshold());
        copy.setMediumTextThreshold(source.getMediumTextThreshold());
        copy.setConcurrencyLimit(source.getConcurrencyLimit());
        copy.setOutputDir(source.getOutputDir());
        copy.setOcrLanguage(source.getOcrLanguage());
        copy.setTessdataPath(source.getTessdataPath());
        copy.setDocumentTitle(source.getDocumentTitle());
        copy.setEndMarker(source.getEndMarker());
        return copy;
    }
}
