package com.example.charging.service;

import com.example.charging.dto.QueueCommand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class QueueCommandParserTest {

    private QueueCommandParser parser;

    @BeforeEach
    void setUp() {
        parser = new QueueCommandParser();
    }

    @Test
    void shouldParseJoin() {
        Optional<QueueCommand> parsed = parser.parse("JOIN:12:380501112233");

        assertThat(parsed).contains(new QueueCommand(QueueCommand.Action.JOIN, 12L, "380501112233", null));
    }

    @Test
    void shouldParseReserveWithTtl() {
        Optional<QueueCommand> parsed = parser.parse("reserve:12:380501112233:15");

        assertThat(parsed).isPresent();
        QueueCommand command = parsed.get();
        assertThat(command.action()).isEqualTo(QueueCommand.Action.RESERVE);
        assertThat(command.extra()).isEqualTo("15");
    }

    @Test
    void shouldParseDashedActionAndMeterReading() {
        Optional<QueueCommand> parsed = parser.parse(" start-session:3:user_7:1204.75 ");

        assertThat(parsed).hasValueSatisfying(command -> {
            assertThat(command.action()).isEqualTo(QueueCommand.Action.START_SESSION);
            assertThat(command.resourceId()).isEqualTo(3L);
            assertThat(command.userId()).isEqualTo("user_7");
            assertThat(command.extra()).isEqualTo("1204.75");
        });
    }

    @Test
    void shouldParseLeaveReason() {
        assertThat(parser.parse("LEAVE:12:u1:completed"))
                .hasValueSatisfying(command -> assertThat(command.extra()).isEqualTo("completed"));
    }

    @Test
    void shouldTreatEmptyExtraAsAbsent() {
        assertThat(parser.parse("STATUS:12:u1:"))
                .hasValueSatisfying(command -> assertThat(command.extra()).isNull());
    }

    @Test
    void shouldRejectBlankInput() {
        assertThat(parser.parse(null)).isEmpty();
        assertThat(parser.parse("   ")).isEmpty();
    }

    @Test
    void shouldRejectUnknownAction() {
        assertThat(parser.parse("TELEPORT:12:u1")).isEmpty();
    }

    @Test
    void shouldRejectBadResourceId() {
        assertThat(parser.parse("JOIN:abc:u1")).isEmpty();
        assertThat(parser.parse("JOIN:0:u1")).isEmpty();
        assertThat(parser.parse("JOIN:-4:u1")).isEmpty();
    }

    @Test
    void shouldRejectWrongPartCount() {
        assertThat(parser.parse("JOIN:12")).isEmpty();
        assertThat(parser.parse("RESERVE:12:u1:15:extra")).isEmpty();
    }

    @Test
    void shouldRejectInvalidUserId() {
        assertThat(parser.parse("JOIN:12: ")).isEmpty();
        assertThat(parser.parse("JOIN:12:bad user")).isEmpty();
    }

    @Test
    void shouldRejectArgumentsThatDoNotFitAction() {
        assertThat(parser.parse("RESERVE:12:u1:soon")).isEmpty();
        assertThat(parser.parse("RESERVE:12:u1:-5")).isEmpty();
        assertThat(parser.parse("LEAVE:12:u1:bored")).isEmpty();
        assertThat(parser.parse("STOP_SESSION:12:u1:-1")).isEmpty();
        assertThat(parser.parse("JOIN:12:u1:now")).isEmpty();
    }
}
