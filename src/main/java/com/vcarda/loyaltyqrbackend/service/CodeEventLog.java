package com.vcarda.loyaltyqrbackend.service;

import com.vcarda.loyaltyqrbackend.entity.CodeEvent;
import com.vcarda.loyaltyqrbackend.entity.CodeEventType;
import com.vcarda.loyaltyqrbackend.repository.CodeEventRepository;
import com.vcarda.loyaltyqrbackend.util.QrPayloadCodec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Appends lifecycle events for code records. Must be called inside the transaction that performs
 * the transition, so the event and the state change commit together.
 */
@Component
@RequiredArgsConstructor
public class CodeEventLog {

    private final CodeEventRepository eventRepo;
    private final QrPayloadCodec codec;
    private final Clock clock;

    public CodeEvent append(Long codeId, CodeEventType type, Map<String, ?> data) {
        CodeEvent event = new CodeEvent();
        event.setCodeId(codeId);
        event.setEventType(type);
        event.setEventData(data == null || data.isEmpty() ? null : codec.toJson(data));
        event.setCreatedAt(OffsetDateTime.now(clock));
        return eventRepo.save(event);
    }
}
