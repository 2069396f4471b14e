package com.abba.answerdesk.infrastructure.web;

public record OperatorCommandRequest(String operatorId, String text) {
}
