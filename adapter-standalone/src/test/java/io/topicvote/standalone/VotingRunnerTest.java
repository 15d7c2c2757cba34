package io.topicvote.standalone;

import static io.topicvote.standalone.ContextDocumentTest.input;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.topicvote.core.error.RegistrationException;
import io.topicvote.core.error.VariableNotFoundException;
import io.topicvote.core.error.VotingParseException;
import io.topicvote.standalone.config.ConfigLoader;
import io.topicvote.standalone.config.VotingConfig;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("VotingRunner")
class VotingRunnerTest {

    private VotingRunner runner;
    private ContextDocument document;

    @BeforeEach
    void setUp() throws Exception {
        VotingConfig config = ConfigLoader.load(ContextDocumentTest.config("full-config.yaml"), name -> null);
        runner = new VotingRunner(config);
        document = ContextDocument.read(input("voters.json"));
    }

    private static List<Long> ranks(JsonNode output) {
        List<Long> ranks = new ArrayList<>();
        output.get("voters").forEach(voter -> ranks.add(voter.get("rank").longValue()));
        return ranks;
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("declarations and aliases are registered at construction")
        void registersConfiguredNames() {
            assertThat(runner.engine().registry().names())
                    .containsExactlyInAnyOrder("doubled", "top_two", "tripled", "thrice");
        }

        @Test
        @DisplayName("a declaration shadowing a build-in fails construction")
        void brokenDeclaration() throws Exception {
            VotingConfig config = ConfigLoader.load(ContextDocumentTest.config("broken-declaration.yaml"), name -> null);

            assertThatThrownBy(() -> new VotingRunner(config)).isInstanceOf(RegistrationException.class);
        }
    }

    @Nested
    @DisplayName("Evaluation")
    class Evaluation {

        @Test
        @DisplayName("configured default voting is used without an override")
        void defaultVoting() {
            ObjectNode output = runner.run(document, null);

            assertThat(output.get("result").doubleValue()).isEqualTo(1.0);
            assertThat(output.get("voters")).hasSize(3);
        }

        @Test
        @DisplayName("configured epsilon is bound when the document has none")
        void epsilonInserted() {
            ObjectNode output = runner.run(document, null);

            assertThat(output.get("global").get("epsilon").doubleValue()).isEqualTo(0.001);
        }

        @Test
        @DisplayName("document epsilon wins over the configured one")
        void documentEpsilonKept() throws Exception {
            ObjectNode output = runner.run(ContextDocument.read(input("with-epsilon.json")), "global: epsilon");

            assertThat(output.get("result").doubleValue()).isEqualTo(0.5);
        }

        @Test
        @DisplayName("registered names and aliases resolve")
        void registeredNames() throws Exception {
            assertThat(runner.run(document, "doubled").get("result").doubleValue()).isEqualTo(1.4);
            assertThat(runner.run(ContextDocument.read(input("voters.json")), "thrice")
                            .get("result")
                            .doubleValue())
                    .isCloseTo(2.1, within(1e-9));
        }

        @Test
        @DisplayName("limited voting leaves the voters sorted by rank")
        void limitedSortsVoters() {
            ObjectNode output = runner.run(document, "CombSum(2)");

            assertThat(output.get("result").doubleValue()).isEqualTo(0.75);
            assertThat(ranks(output)).containsExactly(1L, 2L, 3L);
        }

        @Test
        @DisplayName("voter writes show up in the output")
        void voterWrites() {
            ObjectNode output = runner.run(document, "foreach: let w = score * 2");

            assertThat(output.get("result").isNull()).isTrue();
            assertThat(output.get("voters").get(1).get("w").doubleValue()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("no voting to evaluate")
        void noVoting() throws Exception {
            VotingRunner bare = new VotingRunner(VotingConfig.builder().build());

            assertThatThrownBy(() -> bare.run(document, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageStartingWith("No voting to evaluate");
        }

        @Test
        @DisplayName("parse errors propagate")
        void parseError() {
            assertThatThrownBy(() -> runner.run(document, "nope")).isInstanceOf(VotingParseException.class);
        }

        @Test
        @DisplayName("evaluation errors propagate unchanged")
        void evaluationError() {
            assertThatThrownBy(() -> runner.run(document, "global: missing + 1"))
                    .isInstanceOf(VariableNotFoundException.class);
        }
    }
}
