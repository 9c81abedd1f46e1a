package com.example.safespace.dao;

import com.example.safespace.entity.TurnEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface TurnRepository extends JpaRepository<TurnEntity, UUID> {

    @Query("""
        SELECT t
        FROM TurnEntity t
        WHERE t.session.id = :sessionId
        ORDER BY t.position ASC
        """)
    List<TurnEntity> findHistory(@Param("sessionId") UUID sessionId);

    @Query("SELECT COALESCE(MAX(t.position), 0) FROM TurnEntity t WHERE t.session.id = :sessionId")
    int findLastPosition(@Param("sessionId") UUID sessionId);

    @Modifying
    @Query("DELETE FROM TurnEntity t WHERE t.session.id = :sessionId")
    int deleteAllBySession(@Param("sessionId") UUID sessionId);
}
