package com.vcarda.loyaltyqrbackend.repository;

import com.vcarda.loyaltyqrbackend.entity.CustomerBusinessRelationship;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import javax.persistence.LockModeType;
import java.util.Optional;

public interface CustomerBusinessRelationshipRepository extends JpaRepository<CustomerBusinessRelationship, Long> {

    Optional<CustomerBusinessRelationship> findByCustomerIdAndBusinessId(Long customerId, Long businessId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from CustomerBusinessRelationship r where r.customerId = :customerId and r.businessId = :businessId")
    Optional<CustomerBusinessRelationship> findForUpdate(@Param("customerId") Long customerId,
                                                         @Param("businessId") Long businessId);
}
