package app.fieldclone.core.content.entity;

import jakarta.persistence.*;

import java.util.UUID;

@Entity
@Table(name = "user_accounts", schema = "app_clone")
public class UserAccountEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "user_account_id", nullable = false)
    private Long userAccountId;

    @Column(name = "auth_user_id", unique = true)
    private UUID authUserId;

    @Column(name = "display_name", nullable = false)
    private String displayName;

    protected UserAccountEntity() {
    }

    public UserAccountEntity(UUID authUserId, String displayName) {
        this.authUserId = authUserId;
        this.displayName = displayName;
    }

    public Long getUserAccountId() {
        return userAccountId;
    }

    public UUID getAuthUserId() {
        return authUserId;
    }

    public String getDisplayName() {
        return displayName;
    }
}
