package com.vcarda.loyaltyqrbackend.service.scan;

import com.vcarda.loyaltyqrbackend.entity.CodeType;
import com.vcarda.loyaltyqrbackend.entity.ScanDailyStat;
import com.vcarda.loyaltyqrbackend.repository.ScanDailyStatRepository;
import com.vcarda.loyaltyqrbackend.service.StoreRetryExecutor;
import com.vcarda.loyaltyqrbackend.support.StoreStubs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ScanAnalyticsRecorder.
 */
@ExtendWith(MockitoExtension.class)
class ScanAnalyticsRecorderTest {

    private static final LocalDate DAY = LocalDate.of(2026, 3, 1);

    @Mock private ScanDailyStatRepository statRepo;
    @Mock private StoreRetryExecutor store;

    private ScanAnalyticsRecorder recorder;

    @BeforeEach
    void setUp() {
        recorder = new ScanAnalyticsRecorder(statRepo, store);
        StoreStubs.runInline(store);
    }

    private static ScanDailyStat stat(long total, long successful) {
        ScanDailyStat stat = new ScanDailyStat();
        stat.setStatDate(DAY);
        stat.setBusinessId(7L);
        stat.setCodeType(CodeType.PROMO_CODE.name());
        stat.setTotalScans(total);
        stat.setSuccessfulScans(successful);
        return stat;
    }

    @Test
    void firstScanOfDay_createsRow() {
        when(statRepo.findForUpdate(DAY, 7L, "PROMO_CODE")).thenReturn(Optional.empty());

        recorder.record(7L, CodeType.PROMO_CODE, true, DAY);

        ArgumentCaptor<ScanDailyStat> saved = ArgumentCaptor.forClass(ScanDailyStat.class);
        verify(statRepo).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getTotalScans()).isEqualTo(1);
        assertThat(saved.getValue().getSuccessfulScans()).isEqualTo(1);
        assertThat(saved.getValue().getStatDate()).isEqualTo(DAY);
    }

    @Test
    void failedScan_countsTotalOnly() {
        ScanDailyStat existing = stat(3, 2);
        when(statRepo.findForUpdate(DAY, 7L, "PROMO_CODE")).thenReturn(Optional.of(existing));

        recorder.record(7L, CodeType.PROMO_CODE, false, DAY);

        assertThat(existing.getTotalScans()).isEqualTo(4);
        assertThat(existing.getSuccessfulScans()).isEqualTo(2);
    }

    @Test
    void concurrentFirstInsert_retriesAsUpdate() {
        ScanDailyStat createdByOtherScan = stat(1, 1);
        when(statRepo.findForUpdate(DAY, 7L, "PROMO_CODE"))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(createdByOtherScan));
        when(statRepo.saveAndFlush(any(ScanDailyStat.class)))
                .thenThrow(new DataIntegrityViolationException("uq_scan_stat"))
                .thenAnswer(inv -> inv.getArgument(0));

        recorder.record(7L, CodeType.PROMO_CODE, true, DAY);

        assertThat(createdByOtherScan.getTotalScans()).isEqualTo(2);
        assertThat(createdByOtherScan.getSuccessfulScans()).isEqualTo(2);
        verify(store, times(2)).executeIsolated(eq("scan-analytics"), any());
    }

    @Test
    void persistentFailure_isSwallowedAfterOneRetry() {
        when(statRepo.findForUpdate(any(), any(), any())).thenReturn(Optional.empty());
        when(statRepo.saveAndFlush(any(ScanDailyStat.class)))
                .thenThrow(new DataIntegrityViolationException("uq_scan_stat"));

        assertThatCode(() -> recorder.record(7L, null, true, DAY)).doesNotThrowAnyException();

        verify(statRepo, times(2)).saveAndFlush(any(ScanDailyStat.class));
        verify(statRepo, times(2)).findForUpdate(DAY, 7L, ScanAnalyticsRecorder.UNKNOWN_TYPE);
    }
}
