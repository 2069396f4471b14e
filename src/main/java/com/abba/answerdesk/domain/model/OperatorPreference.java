package com.abba.answerdesk.domain.model;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Document(collection = "operator_preferences")
@Data
public class OperatorPreference {

    @Id
    private String id;
    private String writingStyle = "professional";
    private List<String> personalityTraits = new ArrayList<>();
    private List<String> interests = new ArrayList<>();
    private List<String> responseRules = new ArrayList<>();
    private OffsetDateTime createdAt = OffsetDateTime.now();
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public void touch() {
        this.updatedAt = OffsetDateTime.now();
    }
}
