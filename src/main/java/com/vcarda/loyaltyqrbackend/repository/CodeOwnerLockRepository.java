package com.vcarda.loyaltyqrbackend.repository;

import com.vcarda.loyaltyqrbackend.entity.CodeOwnerLock;
import com.vcarda.loyaltyqrbackend.entity.CodeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import javax.persistence.LockModeType;
import java.util.Optional;

public interface CodeOwnerLockRepository extends JpaRepository<CodeOwnerLock, Long> {

    boolean existsByOwnerIdAndCodeType(Long ownerId, CodeType codeType);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select l from CodeOwnerLock l where l.ownerId = :ownerId and l.codeType = :codeType")
    Optional<CodeOwnerLock> findForUpdate(@Param("ownerId") Long ownerId, @Param("codeType") CodeType codeType);
}
