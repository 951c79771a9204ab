package com.vcarda.loyaltyqrbackend.repository;

import com.vcarda.loyaltyqrbackend.entity.Business;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BusinessRepository extends JpaRepository<Business, Long> {
}
