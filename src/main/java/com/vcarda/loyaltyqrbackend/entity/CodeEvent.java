package com.vcarda.loyaltyqrbackend.entity;

import lombok.Getter;
import lombok.Setter;

import javax.persistence.*;
import java.time.OffsetDateTime;

/**
 * Append-only audit row for a lifecycle transition of a code record.
 */
@Entity
@Table(
        name = "qr_code_events",
        indexes = {
                @Index(name = "ix_event_code", columnList = "codeId")
        }
)
@Getter
@Setter
public class CodeEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long codeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CodeEventType eventType;

    /** JSON detail, e.g. {"reason":"lost"} or {"newCodeId":12}. */
    @Lob
    private String eventData;

    @Column(nullable = false)
    private OffsetDateTime createdAt;
}
