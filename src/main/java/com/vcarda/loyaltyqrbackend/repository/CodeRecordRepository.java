package com.vcarda.loyaltyqrbackend.repository;

import com.vcarda.loyaltyqrbackend.entity.CodeRecord;
import com.vcarda.loyaltyqrbackend.entity.CodeStatus;
import com.vcarda.loyaltyqrbackend.entity.CodeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import javax.persistence.LockModeType;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository for {@link CodeRecord}.
 *
 * Locking queries ({@code ...ForUpdate}) must run inside an explicit transaction; they take a
 * row lock that serializes rotation, revocation and scan bookkeeping on the same record.
 */
public interface CodeRecordRepository extends JpaRepository<CodeRecord, Long> {

    Optional<CodeRecord> findByUniqueId(String uniqueId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from CodeRecord c where c.id = :id")
    Optional<CodeRecord> findByIdForUpdate(@Param("id") Long id);

    /** Locks every record of an owner/type in the given status (used to demote primaries). */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from CodeRecord c where c.ownerId = :ownerId and c.codeType = :codeType and c.status = :status")
    List<CodeRecord> findForUpdate(@Param("ownerId") Long ownerId,
                                   @Param("codeType") CodeType codeType,
                                   @Param("status") CodeStatus status);

    List<CodeRecord> findByOwnerIdOrderByCreatedAtDesc(Long ownerId);

    List<CodeRecord> findByOwnerIdAndCodeTypeOrderByCreatedAtDesc(Long ownerId, CodeType codeType);

    Optional<CodeRecord> findFirstByOwnerIdAndCodeTypeAndStatusAndPrimaryTrueOrderByCreatedAtDesc(
            Long ownerId, CodeType codeType, CodeStatus status);

    Optional<CodeRecord> findFirstByOwnerIdAndCodeTypeAndStatusOrderByCreatedAtDesc(
            Long ownerId, CodeType codeType, CodeStatus status);

    long countByOwnerIdAndCodeTypeAndStatusAndPrimaryTrue(Long ownerId, CodeType codeType, CodeStatus status);

    /**
     * Conditional ACTIVE -> EXPIRED transition.
     *
     * @return 1 if this call performed the transition, 0 if the record was no longer ACTIVE
     */
    @Modifying
    @Query("update CodeRecord c set c.status = :expired, c.updatedAt = :now "
            + "where c.id = :id and c.status = :active")
    int markExpired(@Param("id") Long id,
                    @Param("now") OffsetDateTime now,
                    @Param("active") CodeStatus active,
                    @Param("expired") CodeStatus expired);

    @Query("select c.id from CodeRecord c where c.status = :status "
            + "and c.expiryDate is not null and c.expiryDate <= :now")
    List<Long> findIdsExpiringBefore(@Param("status") CodeStatus status, @Param("now") OffsetDateTime now);

    @Query("select c.id from CodeRecord c where c.status = :status and c.createdAt < :cutoff order by c.createdAt asc")
    List<Long> findIdsCreatedBefore(@Param("status") CodeStatus status,
                                    @Param("cutoff") OffsetDateTime cutoff,
                                    Pageable page);
}
