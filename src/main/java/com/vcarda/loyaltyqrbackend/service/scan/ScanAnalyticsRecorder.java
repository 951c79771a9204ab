package com.vcarda.loyaltyqrbackend.service.scan;

import com.vcarda.loyaltyqrbackend.entity.CodeType;
import com.vcarda.loyaltyqrbackend.entity.ScanDailyStat;
import com.vcarda.loyaltyqrbackend.repository.ScanDailyStatRepository;
import com.vcarda.loyaltyqrbackend.service.StoreRetryExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Best-effort daily scan counters per (day, business, code type).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScanAnalyticsRecorder {

    static final String UNKNOWN_TYPE = "UNKNOWN";

    private final ScanDailyStatRepository statRepo;
    private final StoreRetryExecutor store;

    public void record(Long businessId, CodeType codeType, boolean success, LocalDate day) {
        String type = codeType == null ? UNKNOWN_TYPE : codeType.name();
        try {
            try {
                increment(businessId, type, success, day);
            } catch (DataIntegrityViolationException e) {
                // another scan created the day's row first; it exists now, so update it
                log.debug("[SCAN] Daily stat row created concurrently, retrying update. businessId={}, type={}",
                        businessId, type);
                increment(businessId, type, success, day);
            }
        } catch (RuntimeException e) {
            log.warn("[SCAN] Analytics update failed. businessId={}, type={}, error={}", businessId, type, e.getMessage());
        }
    }

    private void increment(Long businessId, String type, boolean success, LocalDate day) {
        store.executeIsolated("scan-analytics", status -> {
            ScanDailyStat stat = statRepo.findForUpdate(day, businessId, type).orElse(null);
            if (stat == null) {
                stat = new ScanDailyStat();
                stat.setStatDate(day);
                stat.setBusinessId(businessId);
                stat.setCodeType(type);
            }
            stat.setTotalScans(stat.getTotalScans() + 1);
            if (success) {
                stat.setSuccessfulScans(stat.getSuccessfulScans() + 1);
            }
            return statRepo.saveAndFlush(stat);
        });
    }
}
