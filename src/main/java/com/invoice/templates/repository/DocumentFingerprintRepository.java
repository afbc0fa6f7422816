package com.invoice.templates.repository;

import com.invoice.templates.entity.DocumentFingerprint;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface DocumentFingerprintRepository extends JpaRepository<DocumentFingerprint, Long> {

    Optional<DocumentFingerprint> findByDigest(String digest);
}
