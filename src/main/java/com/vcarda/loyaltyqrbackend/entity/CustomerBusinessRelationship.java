package com.vcarda.loyaltyqrbackend.entity;

import lombok.Getter;
import lombok.Setter;

import javax.persistence.*;
import java.time.OffsetDateTime;

/**
 * Link created the first time a business scans a customer's card.
 * One row per (customer, business); later scans bump interactionCount.
 */
@Entity
@Table(
        name = "customer_business_relationships",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_cbr_customer_business", columnNames = {"customerId", "businessId"})
        }
)
@Getter
@Setter
public class CustomerBusinessRelationship {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long customerId;

    @Column(nullable = false)
    private Long businessId;

    @Column(nullable = false)
    private long interactionCount;

    @Column(nullable = false)
    private OffsetDateTime firstInteractionAt;

    @Column(nullable = false)
    private OffsetDateTime lastInteractionAt;
}
