package com.locationhook.ingest.normalizer;

import com.locationhook.common.model.NormalizedRecord;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Value;

/**
 * Either a complete {@link NormalizedRecord} or the reason none could be produced.
 */
@Value
@Builder(access = AccessLevel.PRIVATE)
public class NormalizationResult {

    boolean valid;
    NormalizedRecord record;
    ValidationError error;

    public static NormalizationResult accepted(NormalizedRecord record) {
        return NormalizationResult.builder()
                .valid(true)
                .record(record)
                .build();
    }

    public static NormalizationResult rejected(ValidationError error) {
        return NormalizationResult.builder()
                .valid(false)
                .error(error)
                .build();
    }
}
