package com.invoice.templates.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * First sighting of a duplicate key.
 */
@Entity
@Table(name = "document_fingerprints")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentFingerprint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 64)
    private String digest;

    @Column(name = "composite_key", nullable = false, length = 512)
    private String compositeKey;

    @Column(name = "template_id")
    private String templateId;

    @Column(name = "source_ref")
    private String sourceRef;

    @Column(name = "first_seen_at", nullable = false)
    private Instant firstSeenAt;

    @PrePersist
    protected void onCreate() {
        if (firstSeenAt == null) {
            firstSeenAt = Instant.now();
        }
    }
}
