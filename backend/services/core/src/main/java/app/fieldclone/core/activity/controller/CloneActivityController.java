package app.fieldclone.core.activity.controller;

import app.fieldclone.core.activity.domain.dto.CloneActivityDTO;
import app.fieldclone.core.activity.service.CloneActivityService;
import app.fieldclone.core.security.CurrentUserProvider;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/entities/{targetId}/clone/activity")
public class CloneActivityController {

    private final CloneActivityService activityService;
    private final CurrentUserProvider currentUserProvider;

    public CloneActivityController(CloneActivityService activityService, CurrentUserProvider currentUserProvider) {
        this.activityService = activityService;
        this.currentUserProvider = currentUserProvider;
    }

    // GET /entities/{targetId}/clone/activity
    @GetMapping
    public List<CloneActivityDTO> recent(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable long targetId
    ) {
        var userId = currentUserProvider.getUserId(jwt);
        try {
            return activityService.recent(targetId, userId);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
        } catch (SecurityException ex) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, ex.getMessage(), ex);
        }
    }
}
