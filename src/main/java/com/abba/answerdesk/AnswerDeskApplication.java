package com.abba.answerdesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AnswerDeskApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnswerDeskApplication.class, args);
    }
}
