package com.vcarda.loyaltyqrbackend.entity;

import lombok.Getter;
import lombok.Setter;

import javax.persistence.*;

/**
 * Customer account as seen by the QR engine. Maintained by the customer service.
 */
@Entity
@Table(name = "customers")
@Getter
@Setter
public class Customer {

    @Id
    private Long id;

    @Column(nullable = false)
    private String name;

    private String email;

    @Column(nullable = false)
    private boolean active = true;
}
