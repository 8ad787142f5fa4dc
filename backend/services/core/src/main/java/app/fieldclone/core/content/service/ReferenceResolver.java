package app.fieldclone.core.content.service;

import app.fieldclone.core.content.domain.AttachmentInfo;

import java.util.Optional;

/**
 * Read-only existence checks used to revalidate reference values before they are written to a target.
 */
public interface ReferenceResolver {

    boolean attachmentExists(long attachmentId);

    boolean entityExists(long entityId);

    boolean taxonomyExists(String taxonomy);

    boolean termExists(String taxonomy, long termId);

    boolean userExists(long userId);

    Optional<AttachmentInfo> findAttachment(long attachmentId);
}
