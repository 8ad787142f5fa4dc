package app.fieldclone.core.backup.repository;

import app.fieldclone.core.backup.entity.FieldBackupEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface FieldBackupRepository extends JpaRepository<FieldBackupEntity, Long> {

    Optional<FieldBackupEntity> findByBackupId(String backupId);

    List<FieldBackupEntity> findByTargetEntityIdOrderByCreatedAtDescIdDesc(Long targetEntityId);

    @Transactional
    @Modifying
    @Query("delete from FieldBackupEntity b where b.backupId = :backupId")
    int deleteByBackupId(@Param("backupId") String backupId);

    @Transactional
    @Modifying
    @Query("delete from FieldBackupEntity b where b.createdAt < :cutoff")
    int deleteCreatedBefore(@Param("cutoff") Instant cutoff);

    @Query("select b.id from FieldBackupEntity b order by b.createdAt asc, b.id asc")
    List<Long> findOldestIds(Pageable pageable);
}
