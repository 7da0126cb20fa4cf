package com.phillippitts.shato.service.generation;

import com.phillippitts.shato.domain.CommandProposal;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class ProposalParserTest {

    private final ProposalParser parser = new ProposalParser();

    @Test
    void parsesCommandProposal() {
        CommandProposal proposal = parser.parse(
                "{\"response\":\"Moving now\",\"command\":\"move_to\",\"command_params\":{\"x\":5,\"y\":7}}");

        assertThat(proposal.replyText()).isEqualTo("Moving now");
        assertThat(proposal.command()).isEqualTo("move_to");
        assertThat(proposal.parameters()).containsEntry("x", 5).containsEntry("y", 7);
    }

    @Test
    void parsesChatReply() {
        CommandProposal proposal = parser.parse("{\"response\":\"Hello there\",\"command\":null,\"command_params\":null}");

        assertThat(proposal.hasCommand()).isFalse();
        assertThat(proposal.replyText()).isEqualTo("Hello there");
    }

    @Test
    void toleratesSurroundingWhitespace() {
        assertThat(parser.parse("\n  {\"response\":\"hi\"}  \n").replyText()).isEqualTo("hi");
    }

    @Test
    void blankCommandMeansChat() {
        assertThat(parser.parse("{\"response\":\"ok\",\"command\":\"\"}").hasCommand()).isFalse();
    }

    @Test
    void missingResponseUsesDefaults() {
        assertThat(parser.parse("{\"command\":\"rotate\",\"command_params\":{}}").replyText())
                .isEqualTo("Command received");
        assertThat(parser.parse("{\"command\":null}").replyText()).isEqualTo("I'm ready to help!");
    }

    @Test
    void commandWithoutParametersHasEmptyParameters() {
        CommandProposal proposal = parser.parse("{\"response\":\"ok\",\"command\":\"rotate\"}");

        assertThat(proposal.hasCommand()).isTrue();
        assertThat(proposal.parameters()).isEmpty();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"not json", "{\"response\": ", "[1, 2, 3]", "   "})
    void unparseableOutputFallsBackToChat(String raw) {
        CommandProposal proposal = parser.parse(raw);

        assertThat(proposal.hasCommand()).isFalse();
        assertThat(proposal.replyText()).isEqualTo(ProposalParser.FALLBACK_REPLY);
    }
}
