package com.vcarda.loyaltyqrbackend.entity;

import lombok.Getter;
import lombok.Setter;

import javax.persistence.*;
import java.time.OffsetDateTime;

@Entity
@Table(name = "promo_redemptions")
@Getter
@Setter
public class PromoRedemption {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long promoId;

    @Column(nullable = false)
    private Long customerId;

    @Column(nullable = false)
    private Long businessId;

    /** QR code record the redemption was made with. */
    @Column(nullable = false)
    private Long codeId;

    @Column(nullable = false)
    private OffsetDateTime redeemedAt;
}
