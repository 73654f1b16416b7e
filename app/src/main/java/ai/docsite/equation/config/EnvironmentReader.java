package ai.docsite.equation.config;

import java.util.Optional;

/**
 * Source of environment values consulted when a CLI option is omitted.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    static EnvironmentReader system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }
}
