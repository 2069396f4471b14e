package com.abba.answerdesk.application.service;

import com.abba.answerdesk.domain.exception.PersistenceException;
import com.abba.answerdesk.domain.model.OperatorPreference;
import com.abba.answerdesk.domain.repository.OperatorPreferenceRepository;
import com.abba.answerdesk.domain.service.OperatorPreferenceService;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
@RequiredArgsConstructor
public class OperatorPreferenceServiceImpl implements OperatorPreferenceService {

    private final OperatorPreferenceRepository operatorPreferenceRepository;

    @Override
    public Optional<OperatorPreference> getPreferences() {
        try {
            return operatorPreferenceRepository.findFirstByOrderByCreatedAtAsc();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load operator preferences", e);
        }
    }

    @Override
    public OperatorPreference savePreferences(OperatorPreference preference) {
        OperatorPreference target = getPreferences().orElseGet(OperatorPreference::new);
        target.setWritingStyle(preference.getWritingStyle());
        target.setPersonalityTraits(preference.getPersonalityTraits());
        target.setInterests(preference.getInterests());
        target.setResponseRules(preference.getResponseRules());
        target.touch();
        try {
            return operatorPreferenceRepository.save(target);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to save operator preferences", e);
        }
    }
}
