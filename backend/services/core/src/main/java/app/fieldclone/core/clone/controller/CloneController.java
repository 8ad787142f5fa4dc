package app.fieldclone.core.clone.controller;

import app.fieldclone.core.clone.domain.CloneOutcome;
import app.fieldclone.core.clone.domain.SelectionAnalysis;
import app.fieldclone.core.clone.domain.dto.ClonePreviewDTO;
import app.fieldclone.core.clone.domain.request.ExecuteCloneRequest;
import app.fieldclone.core.clone.domain.request.ValidateSelectionRequest;
import app.fieldclone.core.clone.service.CloneService;
import app.fieldclone.core.clone.service.FieldPreviewService;
import app.fieldclone.core.security.CurrentUserProvider;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/entities/{targetId}/clone")
public class CloneController {

    private final CloneService cloneService;
    private final FieldPreviewService previewService;
    private final CurrentUserProvider currentUserProvider;

    public CloneController(CloneService cloneService,
                           FieldPreviewService previewService,
                           CurrentUserProvider currentUserProvider) {
        this.cloneService = cloneService;
        this.previewService = previewService;
        this.currentUserProvider = currentUserProvider;
    }

    // GET /entities/{targetId}/clone/preview?source=15
    @GetMapping("/preview")
    public ClonePreviewDTO preview(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable long targetId,
            @RequestParam("source") long sourceId
    ) {
        var userId = currentUserProvider.getUserId(jwt);
        try {
            return previewService.preview(sourceId, targetId, userId);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
        } catch (SecurityException ex) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, ex.getMessage(), ex);
        }
    }

    // POST /entities/{targetId}/clone
    // per-field errors come back in the body with 200
    @PostMapping
    public CloneOutcome execute(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable long targetId,
            @Valid @RequestBody ExecuteCloneRequest request
    ) {
        var userId = currentUserProvider.getUserId(jwt);
        return cloneService.execute(userId, targetId, request);
    }

    // POST /entities/{targetId}/clone/validate
    @PostMapping("/validate")
    public SelectionAnalysis validate(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable long targetId,
            @Valid @RequestBody ValidateSelectionRequest request
    ) {
        var userId = currentUserProvider.getUserId(jwt);
        try {
            return cloneService.validate(userId, targetId, request);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
        } catch (SecurityException ex) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, ex.getMessage(), ex);
        }
    }
}
