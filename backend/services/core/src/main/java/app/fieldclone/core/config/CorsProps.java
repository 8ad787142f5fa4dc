package app.fieldclone.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Allowed browser origins for the clone and backup endpoints.
 */
@ConfigurationProperties(prefix = "app.cors")
public record CorsProps(
        List<String> origins
) {
    static final List<String> DEFAULT_ORIGINS = List.of("http://localhost:3005");

    public CorsProps {
        origins = (origins == null || origins.isEmpty()) ? DEFAULT_ORIGINS : List.copyOf(origins);
    }
}
