package com.abba.answerdesk.domain.service;

import com.abba.answerdesk.domain.model.OperatorPreference;

import java.util.Optional;

public interface OperatorPreferenceService {

    Optional<OperatorPreference> getPreferences();

    OperatorPreference savePreferences(OperatorPreference preference);
}
