package com.abba.answerdesk.application.notification;

public interface OperatorGateway {

    boolean send(String text);
}
