package app.fieldclone.core.content.service;

import app.fieldclone.core.content.domain.AttachmentInfo;
import app.fieldclone.core.content.domain.EntityKind;
import app.fieldclone.core.content.repository.ContentEntityRepository;
import app.fieldclone.core.content.repository.TaxonomyRepository;
import app.fieldclone.core.content.repository.TaxonomyTermRepository;
import app.fieldclone.core.content.repository.UserAccountRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@Transactional(readOnly = true)
public class JpaReferenceResolver implements ReferenceResolver {

    private final ContentEntityRepository contentEntityRepository;
    private final TaxonomyRepository taxonomyRepository;
    private final TaxonomyTermRepository taxonomyTermRepository;
    private final UserAccountRepository userAccountRepository;

    public JpaReferenceResolver(ContentEntityRepository contentEntityRepository,
                                TaxonomyRepository taxonomyRepository,
                                TaxonomyTermRepository taxonomyTermRepository,
                                UserAccountRepository userAccountRepository) {
        this.contentEntityRepository = contentEntityRepository;
        this.taxonomyRepository = taxonomyRepository;
        this.taxonomyTermRepository = taxonomyTermRepository;
        this.userAccountRepository = userAccountRepository;
    }

    @Override
    public boolean attachmentExists(long attachmentId) {
        return contentEntityRepository.existsByEntityIdAndKind(attachmentId, EntityKind.ATTACHMENT);
    }

    @Override
    public boolean entityExists(long entityId) {
        return contentEntityRepository.existsById(entityId);
    }

    @Override
    public boolean taxonomyExists(String taxonomy) {
        return taxonomy != null && !taxonomy.isBlank() && taxonomyRepository.existsById(taxonomy);
    }

    @Override
    public boolean termExists(String taxonomy, long termId) {
        return taxonomyTermRepository.existsByTermIdAndTaxonomy(termId, taxonomy);
    }

    @Override
    public boolean userExists(long userId) {
        return userAccountRepository.existsById(userId);
    }

    @Override
    public Optional<AttachmentInfo> findAttachment(long attachmentId) {
        return contentEntityRepository.findById(attachmentId)
                .filter(entity -> entity.getKind() == EntityKind.ATTACHMENT)
                .map(entity -> new AttachmentInfo(entity.getEntityId(), entity.getTitle(), entity.getFileName()));
    }
}
