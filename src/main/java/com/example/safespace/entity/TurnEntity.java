package com.example.safespace.entity;

import com.example.safespace.model.TurnRole;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.experimental.Accessors;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;
import java.util.UUID;

@Data
@Accessors(chain = true)
@Entity
@Table(
        name = "turns",
        uniqueConstraints = @UniqueConstraint(name = "uk_turns_session_position", columnNames = {"session_id", "position"}),
        indexes = @Index(name = "idx_turns_session_id", columnList = "session_id")
)
public class TurnEntity {

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
    @Column(name = "role", nullable = false, length = 16, updatable = false)
    private TurnRole role;

    @Column(name = "content", nullable = false, columnDefinition = "text", updatable = false)
    private String content;

    @Column(name = "position", nullable = false, updatable = false)
    private Integer position;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
