package com.vcarda.loyaltyqrbackend.entity;

import lombok.Getter;
import lombok.Setter;

import javax.persistence.*;
import java.time.LocalDate;

/**
 * Daily scan counters per business and code type, feeding the analytics service.
 */
@Entity
@Table(
        name = "qr_scan_daily_stats",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_scan_stat", columnNames = {"statDate", "businessId", "codeType"})
        }
)
@Getter
@Setter
public class ScanDailyStat {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private LocalDate statDate;

    @Column(nullable = false)
    private Long businessId;

    /** Code type name, or "UNKNOWN" when the attempt never resolved one. */
    @Column(nullable = false, length = 16)
    private String codeType;

    @Column(nullable = false)
    private long totalScans;

    @Column(nullable = false)
    private long successfulScans;
}
