package app.fieldclone.core.config;

import app.fieldclone.core.clone.domain.CloneOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.clone")
public record CloneProps(
        Integer maxSourceCandidates,
        Defaults defaults
) {
    public static final int DEFAULT_MAX_SOURCE_CANDIDATES = 50;

    public CloneProps {
        if (maxSourceCandidates == null || maxSourceCandidates < 1) {
            maxSourceCandidates = DEFAULT_MAX_SOURCE_CANDIDATES;
        }
        if (defaults == null) {
            defaults = new Defaults(null, null, null, null);
        }
    }

    public record Defaults(
            Boolean overwriteExisting,
            Boolean createBackup,
            Boolean copyReferences,
            Boolean validateData
    ) {
        public CloneOptions toOptions() {
            return new CloneOptions(
                    overwriteExisting != null && overwriteExisting,
                    createBackup == null || createBackup,
                    copyReferences == null || copyReferences,
                    validateData == null || validateData
            );
        }
    }
}
