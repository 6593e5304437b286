package dev.univer.worktracker.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Where one person worked on one day. Exactly one row per (userKey, date).
 */
@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "entries",
       uniqueConstraints = @UniqueConstraint(name = "uq_entries_user_key_date", columnNames = {"user_key", "entry_date"}),
       indexes = @Index(name = "idx_entries_date", columnList = "entry_date"))
public class Entry {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_name", nullable = false)
    private String displayName; // as last typed

    @Column(name = "user_key", nullable = false)
    private String userKey;     // lower-case trimmed, see IdentityNormalizer

    @Column(name = "entry_date", nullable = false)
    private LocalDate date;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Location location;

    @Column(name = "client")
    private String clientDescription;

    @Column(length = 2000)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
