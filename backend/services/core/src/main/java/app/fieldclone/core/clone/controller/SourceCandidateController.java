package app.fieldclone.core.clone.controller;

import app.fieldclone.core.clone.domain.dto.SourceCandidateDTO;
import app.fieldclone.core.clone.service.SourceCandidateService;
import app.fieldclone.core.security.CurrentUserProvider;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/schemas/{schemaId}/candidates")
public class SourceCandidateController {

    private final SourceCandidateService candidateService;
    private final CurrentUserProvider currentUserProvider;

    public SourceCandidateController(SourceCandidateService candidateService, CurrentUserProvider currentUserProvider) {
        this.candidateService = candidateService;
        this.currentUserProvider = currentUserProvider;
    }

    // GET /schemas/{schemaId}/candidates?exclude=42
    @GetMapping
    public List<SourceCandidateDTO> listCandidates(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String schemaId,
            @RequestParam(name = "exclude", defaultValue = "0") long excludeEntityId
    ) {
        var userId = currentUserProvider.getUserId(jwt);
        try {
            return candidateService.listCandidates(schemaId, excludeEntityId, userId);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }
}
