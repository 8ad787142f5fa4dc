package app.fieldclone.core.backup.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class BackupRetentionJob {

    private static final Logger log = LoggerFactory.getLogger(BackupRetentionJob.class);

    private final BackupStore backupStore;

    public BackupRetentionJob(BackupStore backupStore) {
        this.backupStore = backupStore;
    }

    @Scheduled(cron = "${app.backup.sweep-cron:0 30 3 * * *}")
    public void sweep() {
        try {
            int deleted = backupStore.sweepRetention();
            log.debug("Scheduled backup sweep finished deleted={}", deleted);
        } catch (RuntimeException ex) {
            log.warn("Scheduled backup sweep failed error={}", ex.getMessage());
        }
    }
}
