package com.vcarda.loyaltyqrbackend.entity;

import lombok.Getter;
import lombok.Setter;

import javax.persistence.*;
import java.time.OffsetDateTime;

/**
 * Promotion definition. Redemption is capped by maxUses (null = unlimited) and restricted
 * to the [startsAt, expiresAt) window when those are set.
 */
@Entity
@Table(
        name = "promo_codes",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_promo_business_code", columnNames = {"businessId", "code"})
        }
)
@Getter
@Setter
public class PromoCode {

    @Id
    private Long id;

    @Column(nullable = false)
    private Long businessId;

    @Column(nullable = false, length = 64)
    private String code;

    @Column(nullable = false)
    private boolean active = true;

    private OffsetDateTime startsAt;

    private OffsetDateTime expiresAt;

    private Integer maxUses;

    @Column(nullable = false)
    private int currentUses;

    private OffsetDateTime updatedAt;
}
