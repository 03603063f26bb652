package org.eventsourcing.migrations.snapshot;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import org.eventsourcing.migrations.snapshot.jdbc.DatabaseConfig;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads a {@link MigrationConfig} from a YAML ({@code .yml}, {@code .yaml}) or JSON file.
 *
 * {@code ${NAME}} and {@code ${NAME:default}} placeholders are replaced from the environment
 * before parsing, so credentials can stay out of the file.
 */
@Slf4j
public class MigrationConfigLoader {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}:]+)(?::([^}]*))?\\}");

    private static final ObjectMapper YAML_MAPPER = YAMLMapper.builder(new YAMLFactory())
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();
    private static final ObjectMapper JSON_MAPPER = JsonMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    private final UnaryOperator<String> environment;

    public MigrationConfigLoader() {
        this(System::getenv);
    }

    public MigrationConfigLoader(UnaryOperator<String> environment) {
        this.environment = environment;
    }

    public MigrationConfig load(Path file) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InvalidConfigurationException("Cannot read configuration file " + file, e);
        }
        var mapper = isYaml(file) ? YAML_MAPPER : JSON_MAPPER;
        MigrationConfig config;
        try {
            config = mapper.readValue(resolvePlaceholders(content), MigrationConfig.class);
        } catch (IOException e) {
            throw new InvalidConfigurationException("Invalid configuration file " + file + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new InvalidConfigurationException("Configuration file " + file + " is empty");
        }
        validate(config);
        log.atDebug().setMessage("Loaded configuration from {}: {}").addArgument(file).addArgument(config).log();
        return config;
    }

    String resolvePlaceholders(String content) {
        Matcher matcher = PLACEHOLDER.matcher(content);
        var resolved = new StringBuilder();
        while (matcher.find()) {
            var name = matcher.group(1);
            var value = environment.apply(name);
            if (value == null) {
                value = matcher.group(2);
            }
            if (value == null) {
                throw new InvalidConfigurationException("Environment variable " + name
                    + " is not set and has no default");
            }
            matcher.appendReplacement(resolved, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(resolved);
        return resolved.toString();
    }

    static void validate(MigrationConfig config) {
        requireDatabase("source", config.getSource());
        requireDatabase("target", config.getTarget());
        if (config.getJournal() != null) {
            requireDatabase("journal", config.getJournal());
        }
        for (var serializer : config.getJsonSerializers()) {
            if (serializer.getType() == null || serializer.getType().isBlank()) {
                throw new InvalidConfigurationException("JSON serializer " + serializer.getIdentifier()
                    + " needs a type");
            }
        }
    }

    private static void requireDatabase(String name, DatabaseConfig database) {
        if (database == null) {
            throw new InvalidConfigurationException("The " + name + " database is not configured");
        }
        var jdbcUrl = database.getJdbcUrl();
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new InvalidConfigurationException("The " + name + " database needs a jdbcUrl");
        }
    }

    private static boolean isYaml(Path file) {
        var name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yml") || name.endsWith(".yaml");
    }
}
