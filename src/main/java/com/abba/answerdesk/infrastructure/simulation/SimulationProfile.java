package com.abba.answerdesk.infrastructure.simulation;

import com.abba.answerdesk.domain.model.Platform;

import java.util.List;

public record SimulationProfile(double newMessageProbability, List<Template> templates) {

    public record Template(String sender, String content) {
    }

    public static SimulationProfile of(Platform platform) {
        return switch (platform) {
            case LINKEDIN -> new SimulationProfile(0.3, List.of(
                    new Template("John Doe", "Hi! I saw your profile and would love to connect. "
                            + "Are you open to discussing potential collaboration opportunities?"),
                    new Template("Jane Smith", "Thanks for accepting my connection request! "
                            + "I'm interested in learning more about your work in AI.")));
            case GMAIL -> new SimulationProfile(0.2, List.of(
                    new Template("client@example.com", "Hello, I'm interested in your services. "
                            + "Could you please provide more information about your pricing?"),
                    new Template("colleague@company.com", "Hi! Can you review the latest project proposal when you have a chance?")));
            case TELEGRAM -> new SimulationProfile(0.4, List.of(
                    new Template("Alice", "Hey! Are you free for a quick call tomorrow?"),
                    new Template("Bob", "Thanks for the help with the project!")));
            case FACEBOOK -> new SimulationProfile(0.25, List.of(
                    new Template("Friend1", "Happy birthday! Hope you have a great day!"),
                    new Template("Friend2", "Are you going to the event this weekend?")));
            case INSTAGRAM -> new SimulationProfile(0.35, List.of(
                    new Template("Follower1", "Love your latest post!"),
                    new Template("Follower2", "Can you share the recipe for that dish?")));
        };
    }
}
