package com.vcarda.loyaltyqrbackend.entity;

import lombok.Getter;
import lombok.Setter;

import javax.persistence.*;
import java.time.OffsetDateTime;

/**
 * A customer's enrollment card in one loyalty program; holds the points balance.
 */
@Entity
@Table(name = "loyalty_cards")
@Getter
@Setter
public class LoyaltyCard {

    @Id
    private Long id;

    @Column(nullable = false)
    private Long customerId;

    @Column(nullable = false)
    private Long programId;

    @Column(nullable = false)
    private Long businessId;

    @Column(length = 32)
    private String cardNumber;

    @Column(nullable = false)
    private long points;

    @Column(nullable = false)
    private boolean active = true;

    private OffsetDateTime updatedAt;
}
