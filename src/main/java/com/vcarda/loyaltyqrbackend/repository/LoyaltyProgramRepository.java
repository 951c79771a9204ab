package com.vcarda.loyaltyqrbackend.repository;

import com.vcarda.loyaltyqrbackend.entity.LoyaltyProgram;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LoyaltyProgramRepository extends JpaRepository<LoyaltyProgram, Long> {

    List<LoyaltyProgram> findByBusinessIdAndActiveTrueOrderByIdAsc(Long businessId);
}
