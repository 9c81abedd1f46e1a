package com.example.safespace.dao;

import com.example.safespace.entity.ReportEntity;
import com.example.safespace.model.ReportStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ReportRepository extends JpaRepository<ReportEntity, UUID> {

    @Query("SELECT r FROM ReportEntity r WHERE r.session.id = :sessionId")
    Optional<ReportEntity> findBySession(@Param("sessionId") UUID sessionId);

    /**
     * Moves a report to {@code target} unless it already reached {@code GENERATED}; returns the
     * number of updated rows, so {@code 0} means another generation won.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE ReportEntity r
        SET r.status = :target,
            r.generatedDocument = :document,
            r.updatedAt = :now
        WHERE r.id = :id
          AND r.status <> :generated
        """)
    int transition(@Param("id") UUID id,
                   @Param("target") ReportStatus target,
                   @Param("document") String document,
                   @Param("generated") ReportStatus generated,
                   @Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM ReportEntity r WHERE r.session.id = :sessionId")
    int deleteAllBySession(@Param("sessionId") UUID sessionId);
}
