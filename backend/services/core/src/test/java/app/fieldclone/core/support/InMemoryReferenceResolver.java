package app.fieldclone.core.support;

import app.fieldclone.core.content.domain.AttachmentInfo;
import app.fieldclone.core.content.service.ReferenceResolver;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class InMemoryReferenceResolver implements ReferenceResolver {

    private final Map<Long, AttachmentInfo> attachments = new HashMap<>();
    private final Set<Long> entities = new HashSet<>();
    private final Map<String, Set<Long>> terms = new HashMap<>();
    private final Set<Long> users = new HashSet<>();
    private RuntimeException lookupFailure;

    public InMemoryReferenceResolver attachment(long id, String title, String fileName) {
        attachments.put(id, new AttachmentInfo(id, title, fileName));
        return this;
    }

    public InMemoryReferenceResolver entity(long id) {
        entities.add(id);
        return this;
    }

    public InMemoryReferenceResolver term(String taxonomy, long termId) {
        terms.computeIfAbsent(taxonomy, k -> new HashSet<>()).add(termId);
        return this;
    }

    public InMemoryReferenceResolver taxonomy(String taxonomy) {
        terms.computeIfAbsent(taxonomy, k -> new HashSet<>());
        return this;
    }

    public InMemoryReferenceResolver user(long id) {
        users.add(id);
        return this;
    }

    public void failAttachmentLookups(RuntimeException failure) {
        this.lookupFailure = failure;
    }

    public void removeAttachment(long id) {
        attachments.remove(id);
    }

    @Override
    public boolean attachmentExists(long attachmentId) {
        if (lookupFailure != null) {
            throw lookupFailure;
        }
        return attachments.containsKey(attachmentId);
    }

    @Override
    public boolean entityExists(long entityId) {
        return entities.contains(entityId);
    }

    @Override
    public boolean taxonomyExists(String taxonomy) {
        return taxonomy != null && terms.containsKey(taxonomy);
    }

    @Override
    public boolean termExists(String taxonomy, long termId) {
        return terms.getOrDefault(taxonomy, Set.of()).contains(termId);
    }

    @Override
    public boolean userExists(long userId) {
        return users.contains(userId);
    }

    @Override
    public Optional<AttachmentInfo> findAttachment(long attachmentId) {
        return Optional.ofNullable(attachments.get(attachmentId));
    }
}
