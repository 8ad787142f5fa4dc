package app.fieldclone.core.backup.controller;

import app.fieldclone.core.backup.domain.BackupRecord;
import app.fieldclone.core.backup.domain.RestoreResult;
import app.fieldclone.core.backup.service.BackupStore;
import app.fieldclone.core.content.service.EntityAccessService;
import app.fieldclone.core.security.CurrentUserProvider;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

@RestController
public class BackupController {

    private final BackupStore backupStore;
    private final EntityAccessService accessService;
    private final CurrentUserProvider currentUserProvider;

    public BackupController(BackupStore backupStore,
                            EntityAccessService accessService,
                            CurrentUserProvider currentUserProvider) {
        this.backupStore = backupStore;
        this.accessService = accessService;
        this.currentUserProvider = currentUserProvider;
    }

    // GET /entities/{targetId}/backups
    @GetMapping("/entities/{targetId}/backups")
    public List<BackupRecord> list(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable long targetId
    ) {
        var userId = currentUserProvider.getUserId(jwt);
        requireEditable(userId, targetId);
        return backupStore.list(targetId);
    }

    // POST /backups/{backupId}/restore?deleteAfter=false
    @PostMapping("/backups/{backupId}/restore")
    public RestoreResult restore(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String backupId,
            @RequestParam(defaultValue = "false") boolean deleteAfter
    ) {
        var userId = currentUserProvider.getUserId(jwt);
        BackupRecord backup = requireBackup(backupId);
        requireEditable(userId, backup.targetEntityId());
        return backupStore.restore(backupId, deleteAfter);
    }

    // DELETE /backups/{backupId}
    @DeleteMapping("/backups/{backupId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String backupId
    ) {
        var userId = currentUserProvider.getUserId(jwt);
        BackupRecord backup = requireBackup(backupId);
        requireEditable(userId, backup.targetEntityId());
        if (!backupStore.delete(backupId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Backup not found");
        }
    }

    // POST /backups/cleanup
    @PostMapping("/backups/cleanup")
    @PreAuthorize("hasAuthority('SCOPE_content.admin')")
    public CleanupResponse cleanup() {
        return new CleanupResponse(backupStore.sweepRetention());
    }

    private BackupRecord requireBackup(String backupId) {
        return backupStore.find(backupId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Backup not found"));
    }

    private void requireEditable(UUID userId, long entityId) {
        try {
            accessService.requireEditable(userId, entityId);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
        } catch (SecurityException ex) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, ex.getMessage(), ex);
        }
    }

    public record CleanupResponse(int deleted) {
    }
}
