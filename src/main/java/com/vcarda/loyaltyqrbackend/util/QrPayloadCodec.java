package com.vcarda.loyaltyqrbackend.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.vcarda.loyaltyqrbackend.entity.CodeRecord;
import com.vcarda.loyaltyqrbackend.exception.CodeValidationException;
import com.vcarda.loyaltyqrbackend.payload.QrPayload;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * JSON codec for {@link QrPayload} and other small JSON blobs stored alongside code records.
 *
 * Uses its own mapper with sorted properties so the persisted (signed) form of a payload does
 * not depend on the application-wide Jackson configuration.
 */
@Component
public class QrPayloadCodec {

    /** Upper bound for scanned text; real codes are well below 1 KB. */
    public static final int MAX_RAW_LENGTH = 4096;

    private final ObjectMapper mapper = JsonMapper.builder()
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndAddModules()
            .build();

    /**
     * Parse scanned or stored text into a payload variant.
     *
     * @throws CodeValidationException if the text is empty, oversized or not a JSON object
     */
    public QrPayload parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new CodeValidationException("scanned payload is empty");
        }
        if (raw.length() > MAX_RAW_LENGTH) {
            throw new CodeValidationException("scanned payload is too large");
        }
        try {
            QrPayload payload = mapper.readValue(raw, QrPayload.class);
            if (payload == null) {
                throw new CodeValidationException("scanned payload is not a QR code document");
            }
            return payload;
        } catch (JsonProcessingException e) {
            throw new CodeValidationException("scanned payload is not a QR code document", e);
        }
    }

    /** Canonical JSON of a payload, signature included only if set. */
    public String write(QrPayload payload) {
        return toJson(payload);
    }

    /**
     * Text to encode into the printed image: the persisted payload with the record signature.
     */
    public String scannableContent(CodeRecord record) {
        QrPayload payload = parse(record.getPayload());
        payload.setSignature(record.getSignature());
        return toJson(payload);
    }

    public String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }

    public String toJson(Map<String, ?> value) {
        return toJson((Object) value);
    }
}
