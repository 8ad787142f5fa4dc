package app.fieldclone.core.content.domain;

public record AttachmentInfo(
        long id,
        String title,
        String fileName
) {
}
