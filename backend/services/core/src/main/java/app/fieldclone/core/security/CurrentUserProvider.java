package app.fieldclone.core.security;

import org.springframework.http.HttpStatus;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

/**
 * Resolves the acting user from the {@code user_id} token claim.
 */
@Component
public class CurrentUserProvider {

    static final String USER_ID_CLAIM = "user_id";

    public UUID getUserId(Jwt jwt) {
        String claim = jwt == null ? null : jwt.getClaimAsString(USER_ID_CLAIM);
        if (claim == null || claim.isBlank()) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Token has no " + USER_ID_CLAIM + " claim");
        }
        try {
            return UUID.fromString(claim);
        } catch (IllegalArgumentException ex) {
            // actor ids are uuids; anything else cannot own an entity
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Malformed " + USER_ID_CLAIM + " claim", ex);
        }
    }
}
