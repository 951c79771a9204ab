package com.vcarda.loyaltyqrbackend.repository;

import com.vcarda.loyaltyqrbackend.entity.ScanDailyStat;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import javax.persistence.LockModeType;
import java.time.LocalDate;
import java.util.Optional;

public interface ScanDailyStatRepository extends JpaRepository<ScanDailyStat, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from ScanDailyStat s where s.statDate = :date and s.businessId = :businessId and s.codeType = :codeType")
    Optional<ScanDailyStat> findForUpdate(@Param("date") LocalDate date,
                                          @Param("businessId") Long businessId,
                                          @Param("codeType") String codeType);
}
