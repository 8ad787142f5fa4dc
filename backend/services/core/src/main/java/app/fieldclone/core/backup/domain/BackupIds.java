package app.fieldclone.core.backup.domain;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.regex.Pattern;

/**
 * Backup identifiers: {@code backup_{targetId}_{epochMillis}_{8 chars of [a-z0-9]}}.
 */
public final class BackupIds {

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int SUFFIX_LENGTH = 8;
    private static final Pattern FORMAT = Pattern.compile("^backup_\\d+_\\d+_[a-z0-9]{8}$");
    private static final SecureRandom RANDOM = new SecureRandom();

    private BackupIds() {
    }

    public static String generate(long targetEntityId, Instant createdAt) {
        StringBuilder suffix = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return "backup_" + targetEntityId + "_" + createdAt.toEpochMilli() + "_" + suffix;
    }

    public static boolean isValid(String backupId) {
        return backupId != null && FORMAT.matcher(backupId).matches();
    }
}
