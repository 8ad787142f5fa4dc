package app.fieldclone.core.clone.controller;

import app.fieldclone.core.clone.domain.FieldStatistics;
import app.fieldclone.core.clone.domain.dto.SourceCandidateDTO;
import app.fieldclone.core.clone.service.SourceCandidateService;
import app.fieldclone.core.config.SecurityConfig;
import app.fieldclone.core.security.CurrentUserProvider;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SourceCandidateController.class)
@Import(SecurityConfig.class)
@ActiveProfiles("test")
class SourceCandidateControllerWebMvcTest {

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    SourceCandidateService candidateService;

    @MockitoBean
    CurrentUserProvider currentUserProvider;

    @MockitoBean
    JwtDecoder jwtDecoder;

    @Test
    void listCandidates_excludesTarget() throws Exception {
        UUID userId = UUID.randomUUID();
        SourceCandidateDTO candidate = new SourceCandidateDTO(15, "Spring sale", "publish",
                Instant.parse("2024-05-01T10:00:00Z"), 4, new FieldStatistics(2, 4, 4, 1, 0, 3));
        when(currentUserProvider.getUserId(any(Jwt.class))).thenReturn(userId);
        when(candidateService.listCandidates("post", 20, userId)).thenReturn(List.of(candidate));

        mockMvc.perform(get("/schemas/{schemaId}/candidates", "post")
                        .with(jwt().jwt(j -> j.claim("user_id", userId.toString())))
                        .param("exclude", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].entityId").value(15))
                .andExpect(jsonPath("$[0].stats.repeaterFields").value(1));
    }
}
