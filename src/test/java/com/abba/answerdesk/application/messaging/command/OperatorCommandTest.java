package com.abba.answerdesk.application.messaging.command;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OperatorCommandTest {

    @Test
    void parsesTargetedCommands() {
        assertThat(OperatorCommand.parse("generate:abc123")).isEqualTo(new OperatorCommand(CommandType.GENERATE, "abc123"));
        assertThat(OperatorCommand.parse("Send:r-1")).isEqualTo(new OperatorCommand(CommandType.SEND, "r-1"));
        assertThat(OperatorCommand.parse(" ignore:m9 ")).isEqualTo(new OperatorCommand(CommandType.IGNORE, "m9"));
    }

    @Test
    void parsesBareCommands() {
        assertThat(OperatorCommand.parse("next").type()).isEqualTo(CommandType.NEXT);
        assertThat(OperatorCommand.parse("/next").type()).isEqualTo(CommandType.NEXT);
        assertThat(OperatorCommand.parse("/start").type()).isEqualTo(CommandType.HELP);
        assertThat(OperatorCommand.parse("help").type()).isEqualTo(CommandType.HELP);
    }

    @Test
    void everythingElseIsFreeText() {
        assertThat(OperatorCommand.parse("Note: call me back later"))
                .isEqualTo(new OperatorCommand(CommandType.TEXT, "Note: call me back later"));
        assertThat(OperatorCommand.parse("edit:")).extracting(OperatorCommand::type).isEqualTo(CommandType.TEXT);
        assertThat(OperatorCommand.parse(null)).isEqualTo(new OperatorCommand(CommandType.TEXT, ""));
    }

    @Test
    void formatsActionsTheWayTheyAreParsed() {
        String command = OperatorCommand.format(CommandType.EDIT, "r42");

        assertThat(command).isEqualTo("edit:r42");
        assertThat(OperatorCommand.parse(command)).isEqualTo(new OperatorCommand(CommandType.EDIT, "r42"));
    }
}
