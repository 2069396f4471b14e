package com.abba.answerdesk.application.messaging.classifier;

import com.abba.answerdesk.domain.model.MessageCategory;

public interface MessageClassifier {

    MessageCategory classify(String content, String sender, String platform);
}
