package app.fieldclone.core.backup.controller;

import app.fieldclone.core.backup.domain.BackupFieldSnapshot;
import app.fieldclone.core.backup.domain.BackupRecord;
import app.fieldclone.core.backup.domain.RestoreResult;
import app.fieldclone.core.backup.service.BackupStore;
import app.fieldclone.core.config.SecurityConfig;
import app.fieldclone.core.content.service.EntityAccessService;
import app.fieldclone.core.schema.domain.FieldType;
import app.fieldclone.core.security.CurrentUserProvider;
import com.fasterxml.jackson.databind.node.IntNode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(BackupController.class)
@Import(SecurityConfig.class)
@ActiveProfiles("test")
class BackupControllerWebMvcTest {

    static final String BACKUP_ID = "backup_20_1700000000000_abcd1234";

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    BackupStore backupStore;

    @MockitoBean
    EntityAccessService accessService;

    @MockitoBean
    CurrentUserProvider currentUserProvider;

    @MockitoBean
    JwtDecoder jwtDecoder;

    @Test
    void list_returnsBackupsOfTarget() throws Exception {
        UUID userId = UUID.randomUUID();
        when(currentUserProvider.getUserId(any(Jwt.class))).thenReturn(userId);
        when(backupStore.list(20)).thenReturn(List.of(record(userId)));

        mockMvc.perform(get("/entities/{targetId}/backups", 20)
                        .with(jwt().jwt(j -> j.claim("user_id", userId.toString()))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].backupId").value(BACKUP_ID))
                .andExpect(jsonPath("$[0].fields.price.value").value(7))
                .andExpect(jsonPath("$[0].fields.price.type").value("NUMBER"));

        verify(accessService).requireEditable(userId, 20);
    }

    @Test
    void list_forbiddenForForeignTarget() throws Exception {
        UUID userId = UUID.randomUUID();
        when(currentUserProvider.getUserId(any(Jwt.class))).thenReturn(userId);
        when(accessService.requireEditable(userId, 20)).thenThrow(new SecurityException("Access denied"));

        mockMvc.perform(get("/entities/{targetId}/backups", 20)
                        .with(jwt().jwt(j -> j.claim("user_id", userId.toString()))))
                .andExpect(status().isForbidden());

        verify(backupStore, never()).list(anyLong());
    }

    @Test
    void restore_returnsResult() throws Exception {
        UUID userId = UUID.randomUUID();
        when(currentUserProvider.getUserId(any(Jwt.class))).thenReturn(userId);
        when(backupStore.find(BACKUP_ID)).thenReturn(Optional.of(record(userId)));
        when(backupStore.restore(BACKUP_ID, true))
                .thenReturn(new RestoreResult(true, "Restored 1 field(s)", List.of("price"), List.of()));

        mockMvc.perform(post("/backups/{backupId}/restore", BACKUP_ID)
                        .with(jwt().jwt(j -> j.claim("user_id", userId.toString())))
                        .param("deleteAfter", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.restoredFields[0]").value("price"));
    }

    @Test
    void restore_unknownBackupIsNotFound() throws Exception {
        when(currentUserProvider.getUserId(any(Jwt.class))).thenReturn(UUID.randomUUID());
        when(backupStore.find(BACKUP_ID)).thenReturn(Optional.empty());

        mockMvc.perform(post("/backups/{backupId}/restore", BACKUP_ID)
                        .with(jwt().jwt(j -> j.claim("user_id", UUID.randomUUID().toString()))))
                .andExpect(status().isNotFound());

        verify(backupStore, never()).restore(any(), anyBoolean());
    }

    @Test
    void delete_returnsNoContent() throws Exception {
        UUID userId = UUID.randomUUID();
        when(currentUserProvider.getUserId(any(Jwt.class))).thenReturn(userId);
        when(backupStore.find(BACKUP_ID)).thenReturn(Optional.of(record(userId)));
        when(backupStore.delete(BACKUP_ID)).thenReturn(true);

        mockMvc.perform(delete("/backups/{backupId}", BACKUP_ID)
                        .with(jwt().jwt(j -> j.claim("user_id", userId.toString()))))
                .andExpect(status().isNoContent());
    }

    @Test
    void cleanup_requiresAdminScope() throws Exception {
        when(backupStore.sweepRetention()).thenReturn(3);

        mockMvc.perform(post("/backups/cleanup")
                        .with(jwt().jwt(j -> j.claim("user_id", UUID.randomUUID().toString()))
                                .authorities(new SimpleGrantedAuthority("SCOPE_content.admin"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(3));

        mockMvc.perform(post("/backups/cleanup")
                        .with(jwt().jwt(j -> j.claim("user_id", UUID.randomUUID().toString()))
                                .authorities(new SimpleGrantedAuthority("SCOPE_content.read"))))
                .andExpect(status().isForbidden());

        verify(backupStore, times(1)).sweepRetention();
    }

    private static BackupRecord record(UUID actorId) {
        return new BackupRecord(BACKUP_ID, 20, actorId, 1,
                Map.of("price", new BackupFieldSnapshot(IntNode.valueOf(7), "Price", FieldType.NUMBER)),
                Instant.parse("2024-05-01T10:00:00Z"));
    }
}
