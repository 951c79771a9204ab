package com.vcarda.loyaltyqrbackend.entity;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import javax.persistence.*;

/**
 * One row per (owner, code type). Primary issuance locks it before demoting, so the row exists
 * even when the owner has no ACTIVE code of that type yet.
 */
@Entity
@Table(
        name = "qr_code_owner_locks",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_qr_owner_lock", columnNames = {"ownerId", "codeType"})
        }
)
@Getter
@Setter
@NoArgsConstructor
public class CodeOwnerLock {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long ownerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CodeType codeType;

    public CodeOwnerLock(Long ownerId, CodeType codeType) {
        this.ownerId = ownerId;
        this.codeType = codeType;
    }
}
