package com.vcarda.loyaltyqrbackend.repository;

import com.vcarda.loyaltyqrbackend.entity.ScanRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ScanRecordRepository extends JpaRepository<ScanRecord, Long> {

    List<ScanRecord> findByCodeRefOrderByCreatedAtDesc(Long codeRef);

    List<ScanRecord> findByScannedByBusinessIdOrderByCreatedAtDesc(Long scannedByBusinessId);
}
