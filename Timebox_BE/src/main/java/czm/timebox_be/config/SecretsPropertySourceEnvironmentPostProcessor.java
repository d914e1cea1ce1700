package czm.timebox_be.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

/**
 * Loads the database password and the calendar access token from Docker secret files
 * before the regular property sources are consulted.
 * <p>
 * Files are looked up in {@code SECRETS_DIR} (default {@code /run/secrets}). A missing or blank
 * file leaves the key to environment variables and {@code application.yml}.
 */
public class SecretsPropertySourceEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {

    private static final Logger log = LoggerFactory.getLogger(SecretsPropertySourceEnvironmentPostProcessor.class);

    static final String PROPERTY_SOURCE_NAME = "secretsPropertySource";
    private static final String SECRETS_DIR_ENV = "SECRETS_DIR";
    private static final String DEFAULT_SECRETS_DIR = "/run/secrets";

    private final List<SecretDescriptor> secretDescriptors;

    public SecretsPropertySourceEnvironmentPostProcessor() {
        this(defaultSecretDescriptors(Path.of(Optional.ofNullable(System.getenv(SECRETS_DIR_ENV)).orElse(DEFAULT_SECRETS_DIR))));
    }

    SecretsPropertySourceEnvironmentPostProcessor(List<SecretDescriptor> secretDescriptors) {
        this.secretDescriptors = List.copyOf(secretDescriptors);
    }

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        Map<String, Object> secrets = new LinkedHashMap<>();
        secretDescriptors.forEach(descriptor -> readSecret(descriptor.path())
                .ifPresent(value -> secrets.put(descriptor.key(), value)));

        if (secrets.isEmpty()) {
            log.info("No secret files found, using env vars and application.yml");
            return;
        }
        environment.getPropertySources().addFirst(new MapPropertySource(PROPERTY_SOURCE_NAME, secrets));
        log.info("Loaded secrets for keys {}", secrets.keySet());
    }

    private static Optional<String> readSecret(Path path) {
        if (!Files.isReadable(path)) {
            return Optional.empty();
        }
        try {
            String value = Files.readString(path).trim();
            return value.isEmpty() ? Optional.empty() : Optional.of(value);
        } catch (IOException exception) {
            log.warn("Failed to read secret from {}", path, exception);
            return Optional.empty();
        }
    }

    static List<SecretDescriptor> defaultSecretDescriptors(Path secretsDir) {
        return List.of(
                new SecretDescriptor("DB_PASSWORD", secretsDir.resolve("timebox_postgres-password")),
                new SecretDescriptor("CALENDAR_TOKEN", secretsDir.resolve("timebox_calendar-access-token")));
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }

    record SecretDescriptor(String key, Path path) {}
}
