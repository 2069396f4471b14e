package com.abba.answerdesk.domain.repository;

import com.abba.answerdesk.domain.model.OperatorPreference;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface OperatorPreferenceRepository extends MongoRepository<OperatorPreference, String> {

    Optional<OperatorPreference> findFirstByOrderByCreatedAtAsc();

}
