package com.vcarda.loyaltyqrbackend.entity;

import lombok.Getter;
import lombok.Setter;

import javax.persistence.*;
import java.time.OffsetDateTime;

/**
 * Entity representing one issued QR code.
 *
 * The payload column holds the signed JSON document; a scan is only a lookup key into this row
 * and every business-relevant field is re-read from here. Rows are never deleted: status moves
 * one way out of ACTIVE and rotations link predecessor and successor.
 */
@Entity
@Table(
        name = "qr_codes",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_qr_unique_id", columnNames = {"uniqueId"})
        },
        indexes = {
                @Index(name = "ix_qr_owner_type", columnList = "ownerId,codeType,status")
        }
)
@Getter
@Setter
public class CodeRecord {

    /** Auto-incremented primary key. */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Opaque external token (UUID) carried inside the printed code. */
    @Column(nullable = false, length = 36)
    private String uniqueId;

    /** Owning customer. */
    @Column(nullable = false)
    private Long ownerId;

    /** Business the code is bound to, if any. */
    private Long relatedBusinessId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CodeType codeType;

    /** Signed JSON payload (tagged union, see {@code QrPayload}). */
    @Lob
    @Column(nullable = false)
    private String payload;

    /** Optional reference to a rendered image of this code. */
    @Column(length = 512)
    private String imageRef;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CodeStatus status;

    /** Six-character code for manual entry when the image cannot be read. */
    @Column(nullable = false, length = 6)
    private String verificationCode;

    @Column(name = "is_primary", nullable = false)
    private boolean primary;

    @Column(nullable = false)
    private long usesCount;

    private OffsetDateTime lastUsedAt;

    /** Hard expiry; null means the code only ages out through rotation. */
    private OffsetDateTime expiryDate;

    @Column(length = 255)
    private String revokedReason;

    private OffsetDateTime revokedAt;

    /** Id of the successor record once this one is REPLACED. */
    private Long replacedByRef;

    /** uniqueId of the record this one replaced. */
    @Column(length = 36)
    private String previousRef;

    /** "hexHmac.epochSeconds" over payload + creation time. */
    @Column(nullable = false, length = 128)
    private String signature;

    @Column(nullable = false)
    private OffsetDateTime createdAt;

    @Column(nullable = false)
    private OffsetDateTime updatedAt;

    public boolean isActive() {
        return status == CodeStatus.ACTIVE;
    }
}
