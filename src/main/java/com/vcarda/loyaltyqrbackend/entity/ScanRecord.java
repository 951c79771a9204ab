package com.vcarda.loyaltyqrbackend.entity;

import lombok.Getter;
import lombok.Setter;

import javax.persistence.*;
import java.time.OffsetDateTime;

/**
 * Entity representing the terminal outcome of one scan attempt.
 *
 * Written exactly once per attempt (rate-limited, invalid, successful or failed) and never updated.
 * The raw scanned text is not stored; only its SHA-256 hash.
 */
@Entity
@Table(
        name = "qr_code_scans",
        indexes = {
                @Index(name = "ix_scan_code", columnList = "codeRef"),
                @Index(name = "ix_scan_business_created", columnList = "scannedByBusinessId,createdAt")
        }
)
@Getter
@Setter
public class ScanRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Code record id; null when the attempt failed before a record was resolved. */
    private Long codeRef;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private CodeType codeType;

    @Column(nullable = false)
    private Long scannedByBusinessId;

    @Column(length = 64)
    private String sourceAddress;

    /** Terminal dispatcher state. */
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ScanState state;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ScanOutcomeStatus outcome;

    private Integer pointsAwarded;

    @Column(length = 40)
    private String errorCode;

    /** Structured detail (JSON) of the outcome. */
    @Lob
    private String resultDetail;

    /** Hex SHA-256 of the raw scanned text. */
    @Column(length = 64)
    private String payloadHash;

    @Column(nullable = false)
    private OffsetDateTime createdAt;
}
