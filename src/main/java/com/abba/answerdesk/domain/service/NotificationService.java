package com.abba.answerdesk.domain.service;

import com.abba.answerdesk.domain.model.Message;

public interface NotificationService {

    void notifyNewMessage(Message message);

}
