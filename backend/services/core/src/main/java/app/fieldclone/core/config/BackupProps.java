package app.fieldclone.core.config;

import app.fieldclone.core.backup.domain.BackupFailurePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param retentionDays age limit in days, 0 disables the age rule
 * @param maxCount      total number of backups kept, 0 disables the count rule
 */
@ConfigurationProperties(prefix = "app.backup")
public record BackupProps(
        Integer retentionDays,
        Integer maxCount,
        BackupFailurePolicy failurePolicy,
        String sweepCron
) {
    public BackupProps {
        if (retentionDays == null || retentionDays < 0) {
            retentionDays = 30;
        }
        if (maxCount == null || maxCount < 0) {
            maxCount = 100;
        }
        if (failurePolicy == null) {
            failurePolicy = BackupFailurePolicy.ABORT;
        }
        if (sweepCron == null || sweepCron.isBlank()) {
            sweepCron = "0 30 3 * * *";
        }
    }
}
