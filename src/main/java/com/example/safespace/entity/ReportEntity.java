package com.example.safespace.entity;

import com.example.safespace.model.EvidenceType;
import com.example.safespace.model.IncidentLocation;
import com.example.safespace.model.IncidentType;
import com.example.safespace.model.PerpetratorType;
import com.example.safespace.model.ReportStatus;
import com.example.safespace.model.UserGoal;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.experimental.Accessors;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;
import java.util.UUID;

/**
 * Incident report row. The five structured columns are written once by the first transaction;
 * later transactions only touch {@code status}, {@code generated_document} and {@code updated_at}.
 */
@Data
@Accessors(chain = true)
@Entity
@Table(
        name = "reports",
        uniqueConstraints = @UniqueConstraint(name = "uk_reports_session", columnNames = "session_id")
)
public class ReportEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "session_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private SessionEntity session;

    @Enumerated(EnumType.STRING)
    @Column(name = "location", nullable = false, length = 50, updatable = false)
    private IncidentLocation location;

    @Enumerated(EnumType.STRING)
    @Column(name = "perpetrator", nullable = false, length = 50, updatable = false)
    private PerpetratorType perpetrator;

    @Enumerated(EnumType.STRING)
    @Column(name = "description", nullable = false, length = 100, updatable = false)
    private IncidentType description;

    @Enumerated(EnumType.STRING)
    @Column(name = "evidence", nullable = false, length = 50, updatable = false)
    private EvidenceType evidence;

    @Enumerated(EnumType.STRING)
    @Column(name = "user_goal", nullable = false, length = 100, updatable = false)
    private UserGoal userGoal;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private ReportStatus status = ReportStatus.PENDING_GENERATION;

    @Column(name = "generated_document", columnDefinition = "text")
    private String generatedDocument;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
