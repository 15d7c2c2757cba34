package io.topicvote.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.topicvote.core.ast.NamedVoting;
import io.topicvote.core.error.RegistrationException;
import io.topicvote.core.error.RegistrationException.Reason;
import io.topicvote.core.error.VotingException;
import io.topicvote.core.error.VotingParseException;
import io.topicvote.core.model.Value;
import io.topicvote.core.model.VotingContext;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.ArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

@DisplayName("VotingRegistry")
class VotingRegistryTest {

    private static final String DECLARE_DOUBLE = "declare double { global: score_candidate * 2 }";

    private VotingRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new VotingRegistry();
    }

    @Nested
    @DisplayName("register")
    class Register {

        @Test
        void bindsTheDeclaredName() {
            NamedVoting registered = registry.register(DECLARE_DOUBLE);

            assertThat(registered.name()).isEqualTo("double");
            assertThat(registry.get("double")).containsSame(registered.function());
            assertThat(registry.names()).containsExactly("double");
        }

        @Test
        void registeredFunctionsRun() {
            registry.register(DECLARE_DOUBLE);
            VotingContext global = VotingContext.empty().with("score_candidate", Value.of(0.25));

            Value result = registry.get("double").orElseThrow().execute(global, List.<VotingContext>of());

            assertThat(result).isEqualTo(Value.of(0.5));
        }

        @Test
        void laterDeclarationsMayReferToEarlierOnes() {
            registry.register(DECLARE_DOUBLE);
            registry.register("declare quad {\n  execute(let d = double);\n  global: d * 2\n}");
            VotingContext global = VotingContext.empty().with("score_candidate", Value.of(1.5));

            assertThat(registry.get("quad").orElseThrow().execute(global, List.<VotingContext>of()))
                    .isEqualTo(Value.of(6.0));
            assertThat(registry.names()).containsExactly("double", "quad");
        }

        @Test
        void parseErrorsPropagate() {
            assertThatThrownBy(() -> registry.register("declare broken { global: 1"))
                    .isInstanceOf(VotingParseException.class)
                    .hasMessageStartingWith("Expected closing braces for declare block");
            assertThat(registry.size()).isZero();
        }
    }

    @Nested
    @DisplayName("refusals")
    class Refusals {

        @Test
        void buildInName() {
            assertRefused(() -> registry.register("CombSum"), Reason.BUILD_IN_NOT_REGISTRABLE);
            assertRefused(() -> registry.register("declare RR { global: 1 }"), Reason.BUILD_IN_NOT_REGISTRABLE);
        }

        @Test
        void nameTakenTwice() {
            registry.register(DECLARE_DOUBLE);
            NamedVoting first = new NamedVoting("double", registry.get("double").orElseThrow());

            assertRefused(() -> registry.register("declare double { global: 3 }"), Reason.ALREADY_REGISTERED);
            assertRefused(() -> registry.register("double"), Reason.ALREADY_REGISTERED);
            assertThat(registry.get("double")).containsSame(first.function());
        }

        @Test
        void anonymousFunction() {
            assertRefused(() -> registry.register("global: 1"), Reason.MISSING_DECLARATION_NAME);
            assertRefused(() -> registry.registerAt("alias", "{ global: 1 }"), Reason.MISSING_DECLARATION_NAME);
        }

        @Test
        void limitedVoting() {
            assertRefused(() -> registry.register("CombSum(3)"), Reason.LIMITED_NOT_REGISTRABLE);
        }

        @Test
        void messageNamesTheVoting() {
            registry.register(DECLARE_DOUBLE);

            assertThatThrownBy(() -> registry.register(DECLARE_DOUBLE))
                    .isInstanceOf(RegistrationException.class)
                    .hasMessage("The name is already registered! (double)")
                    .satisfies(e -> {
                        RegistrationException re = (RegistrationException) e;
                        assertThat(re.votingName()).isEqualTo("double");
                        assertThat(re.phase()).isEqualTo(VotingException.Phase.REGISTRATION);
                        assertThat(re.source()).isEqualTo(DECLARE_DOUBLE);
                    });
        }

        private void assertRefused(Runnable registration, Reason reason) {
            int before = registry.size();
            assertThatThrownBy(registration::run)
                    .isInstanceOf(RegistrationException.class)
                    .hasMessageStartingWith(reason.message())
                    .satisfies(e -> assertThat(((RegistrationException) e).reason()).isEqualTo(reason));
            assertThat(registry.size()).isEqualTo(before);
        }
    }

    @Nested
    @DisplayName("registerAt")
    class RegisterAt {

        @Test
        void bindsBothNamesToTheSameInstance() {
            registry.registerAt("alias", DECLARE_DOUBLE);

            assertThat(registry.names()).containsExactly("alias", "double");
            assertThat(registry.get("alias").orElseThrow()).isSameAs(registry.get("double").orElseThrow());
        }

        @Test
        void sameNameBindsOnce() {
            registry.registerAt("double", DECLARE_DOUBLE);

            assertThat(registry.size()).isEqualTo(1);
        }

        @Test
        void takenAliasLeavesTheDeclaredNameUnbound() {
            registry.register("declare alias { global: 1 }");

            assertThatThrownBy(() -> registry.registerAt("alias", DECLARE_DOUBLE))
                    .isInstanceOf(RegistrationException.class)
                    .hasMessage("The name is already registered! (alias)");
            assertThat(registry.contains("double")).isFalse();
        }

        @Test
        void buildInAliasIsRefused() {
            assertThatThrownBy(() -> registry.registerAt("CombMax", DECLARE_DOUBLE))
                    .isInstanceOf(RegistrationException.class)
                    .satisfies(e -> assertThat(((RegistrationException) e).reason())
                            .isEqualTo(Reason.BUILD_IN_NOT_REGISTRABLE));
            assertThat(registry.size()).isZero();
        }
    }

    @Test
    void concurrentRegistrationsOfOneNameBindItOnce() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> attempts = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                attempts.add(pool.submit(() -> {
                    try {
                        registry.register(DECLARE_DOUBLE);
                        return true;
                    } catch (RegistrationException e) {
                        return false;
                    }
                }));
            }
            int successes = 0;
            for (Future<Boolean> attempt : attempts) {
                if (attempt.get(10, TimeUnit.SECONDS)) {
                    successes++;
                }
            }
            assertThat(successes).isEqualTo(1);
            assertThat(registry.size()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Nested
    @DisplayName("logging")
    class Logging {

        private Logger registryLogger;
        private ListAppender<ILoggingEvent> appender;

        @BeforeEach
        void attach() {
            registryLogger = (Logger) LoggerFactory.getLogger(VotingRegistry.class);
            appender = new ListAppender<>();
            appender.start();
            registryLogger.addAppender(appender);
        }

        @AfterEach
        void detach() {
            registryLogger.detachAppender(appender);
            appender.stop();
        }

        @Test
        void successfulRegistrationIsLoggedAtInfo() {
            registry.registerAt("alias", DECLARE_DOUBLE);

            assertThat(appender.list).hasSize(1);
            ILoggingEvent event = appender.list.get(0);
            assertThat(event.getLevel()).isEqualTo(Level.INFO);
            assertThat(event.getFormattedMessage()).isEqualTo("Registered voting [double, alias] (1 operation(s))");
        }

        @Test
        void refusedRegistrationIsNotLogged() {
            assertThatThrownBy(() -> registry.register("CombSum")).isInstanceOf(RegistrationException.class);

            assertThat(appender.list).isEmpty();
        }
    }
}
