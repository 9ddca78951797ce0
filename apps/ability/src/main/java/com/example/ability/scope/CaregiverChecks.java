package com.example.ability.scope;

import com.example.ability.model.User;
import com.example.ability.rule.RuleContext;
import com.example.ability.rule.SubjectView;

/**
 * Caregiver relations of a patient-like subject: one primary ({@code caregiverId}),
 * any number of secondaries ({@code caregiverIds}).
 */
final class CaregiverChecks {

    private CaregiverChecks() {}

    static boolean isPrimaryCaregiver(User user, SubjectView patient, RuleContext rule) {
        return user.getId().equals(patient.text("caregiverId"));
    }

    static boolean isCaregiver(User user, SubjectView patient, RuleContext rule) {
        if (isPrimaryCaregiver(user, patient, rule)) {
            return true;
        }
        // a patient being created has no secondary caregivers yet
        return patient.texts("caregiverIds").contains(user.getId());
    }
}
