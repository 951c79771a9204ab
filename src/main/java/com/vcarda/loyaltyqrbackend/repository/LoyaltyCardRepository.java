package com.vcarda.loyaltyqrbackend.repository;

import com.vcarda.loyaltyqrbackend.entity.LoyaltyCard;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import javax.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

public interface LoyaltyCardRepository extends JpaRepository<LoyaltyCard, Long> {

    List<LoyaltyCard> findByCustomerIdAndBusinessIdAndActiveTrueOrderByIdAsc(Long customerId, Long businessId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from LoyaltyCard c where c.id = :id")
    Optional<LoyaltyCard> findByIdForUpdate(@Param("id") Long id);
}
