package com.example.ability.util;

import java.util.List;

/**
 * Persisted patient shape used as a check subject in tests.
 */
public record Patient(
        String id,
        String caregiverId,
        List<String> caregiverIds,
        List<String> entityIds
) {
    public static Patient of(String id, String caregiverId, String... entityIds) {
        return new Patient(id, caregiverId, null, List.of(entityIds));
    }

    public Patient withCaregivers(String... caregiverIds) {
        return new Patient(id, caregiverId, List.of(caregiverIds), entityIds);
    }
}
