package app.fieldclone.core.activity.repository;

import app.fieldclone.core.activity.entity.CloneActivityEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CloneActivityRepository extends JpaRepository<CloneActivityEntity, Long> {

    List<CloneActivityEntity> findByTargetEntityIdOrderByCreatedAtDescActivityIdDesc(Long targetEntityId);

    @Query("""
            select a.activityId from CloneActivityEntity a
            where a.targetEntityId = :targetEntityId
            order by a.createdAt desc, a.activityId desc
            """)
    List<Long> findIdsNewestFirst(@Param("targetEntityId") Long targetEntityId);
}
