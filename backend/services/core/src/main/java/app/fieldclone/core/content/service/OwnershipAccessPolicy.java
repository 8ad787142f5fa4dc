package app.fieldclone.core.content.service;

import app.fieldclone.core.content.domain.EntityRef;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Owners may edit their own entities; holders of the admin scope may edit any.
 */
@Component
public class OwnershipAccessPolicy implements EntityAccessPolicy {

    static final String ADMIN_AUTHORITY = "SCOPE_content.admin";

    @Override
    public boolean canEdit(UUID actorId, EntityRef entity) {
        if (actorId == null || entity == null) {
            return false;
        }
        if (actorId.equals(entity.ownerId())) {
            return true;
        }
        return hasAdminAuthority();
    }

    private boolean hasAdminAuthority() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null) {
            return false;
        }
        for (GrantedAuthority authority : authentication.getAuthorities()) {
            if (ADMIN_AUTHORITY.equals(authority.getAuthority())) {
                return true;
            }
        }
        return false;
    }
}
