package com.abba.answerdesk.application.messaging.classifier;

import com.abba.answerdesk.domain.model.MessageCategory;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordMessageClassifierTest {

    private final KeywordMessageClassifier classifier = new KeywordMessageClassifier();

    @Test
    void recruiterAskingForACallOnLinkedInIsBusiness() {
        MessageCategory category = classifier.classify("Let's schedule a call next week", "recruiter@co.com", "linkedin");

        assertThat(category).isEqualTo(MessageCategory.BUSINESS);
    }

    @Test
    void scoresAddKeywordPatternPlatformAndSenderWeights() {
        Map<MessageCategory, Integer> scores = classifier.score("Let's schedule a call next week", "recruiter@co.com", "linkedin");

        // keyword 2 + pattern 3 + linkedin 2 + sender role 2
        assertThat(scores.get(MessageCategory.BUSINESS)).isEqualTo(9);
        // linkedin -1, sender role -1
        assertThat(scores.get(MessageCategory.PERSONAL)).isEqualTo(-2);
        assertThat(scores.get(MessageCategory.NETWORKING)).isEqualTo(2);
    }

    @Test
    void messageWithoutSignalsIsGeneral() {
        assertThat(classifier.classify("The weather looks mild today", "Sam", "unknown"))
                .isEqualTo(MessageCategory.GENERAL);
    }

    @Test
    void emptyInputIsGeneral() {
        assertThat(classifier.classify(null, null, null)).isEqualTo(MessageCategory.GENERAL);
    }

    @Test
    void tiesGoToTheEarlierCategory() {
        assertThat(classifier.classify("wedding invoice", "Sam", "unknown")).isEqualTo(MessageCategory.BUSINESS);
        assertThat(classifier.classify("dinner problem", "Sam", "unknown")).isEqualTo(MessageCategory.PERSONAL);
    }

    @Test
    void platformDeltaAloneCanDecide() {
        assertThat(classifier.classify("hello", "Sam", "facebook")).isEqualTo(MessageCategory.PERSONAL);
        assertThat(classifier.classify("hello", "Sam", "linkedin")).isEqualTo(MessageCategory.BUSINESS);
    }

    @Test
    void relativesOutweighThePlatformTone() {
        assertThat(classifier.classify("See you soon!", "Mom", "linkedin")).isEqualTo(MessageCategory.PERSONAL);
    }

    @Test
    void matchingIsCaseInsensitive() {
        assertThat(classifier.classify("HOW MUCH is the PRICING for a FREE TRIAL?", "Sam", "unknown"))
                .isEqualTo(MessageCategory.SALES);
    }

    @Test
    void sameInputAlwaysGivesTheSameCategory() {
        MessageCategory first = classifier.classify("My app is broken, can't log in", "user@mail.com", "gmail");

        for (int i = 0; i < 10; i++) {
            assertThat(classifier.classify("My app is broken, can't log in", "user@mail.com", "gmail")).isEqualTo(first);
        }
        assertThat(first).isEqualTo(MessageCategory.SUPPORT);
    }
}
