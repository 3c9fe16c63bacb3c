package com.deepansh.adventure.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RemoteGameEngineTest {

    private static final String BASE = "http://engine.local";
    private static final String TRANSITION_JSON = """
            {"observation": "North of House\\nYou are facing the north side of a white house.",
             "score": 0, "moves": 1, "reward": 0, "done": false,
             "inventory": ["Obj39: brass lantern Parent4"]}
            """;

    private MockRestServiceServer server;
    private RemoteGameEngineFactory factory;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE);
        server = MockRestServiceServer.bindTo(builder).build();

        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(HttpServerErrorException.class, ResourceAccessException.class)
                .build();
        factory = new RemoteGameEngineFactory(builder, RetryRegistry.of(retryConfig));
    }

    @Test
    void create_startsEnvironmentForGame() {
        expectCreate();

        RemoteGameEngine engine = (RemoteGameEngine) factory.create("zork1");

        assertThat(engine.getEnvId()).isEqualTo("env-1");
        server.verify();
    }

    @Test
    void step_postsActionAndParsesTransition() {
        expectCreate();
        server.expect(once(), requestTo(BASE + "/envs/env-1/step"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"action\": \"north\"}"))
                .andRespond(withSuccess(TRANSITION_JSON, MediaType.APPLICATION_JSON));

        Transition t = factory.create("zork1").step("north");

        assertThat(t.observation()).startsWith("North of House");
        assertThat(t.moves()).isEqualTo(1);
        assertThat(t.inventory()).containsExactly("Obj39: brass lantern Parent4");
        server.verify();
    }

    @Test
    void step_serverError_notRetried() {
        expectCreate();
        server.expect(once(), requestTo(BASE + "/envs/env-1/step"))
                .andRespond(withServerError());

        GameEngine engine = factory.create("zork1");

        assertThatThrownBy(() -> engine.step("north"))
                .isInstanceOf(GameEngineException.class)
                .hasMessageContaining("step");
        server.verify();
    }

    @Test
    void validActions_serverError_retriedThenSucceeds() {
        expectCreate();
        server.expect(once(), requestTo(BASE + "/envs/env-1/valid-actions"))
                .andRespond(withServerError());
        server.expect(once(), requestTo(BASE + "/envs/env-1/valid-actions"))
                .andRespond(withSuccess("[\"north\", \"open mailbox\"]", MediaType.APPLICATION_JSON));

        assertThat(factory.create("zork1").getValidActions()).containsExactly("north", "open mailbox");
        server.verify();
    }

    @Test
    void dictionary_persistentFailure_reportedAsEngineException() {
        expectCreate();
        for (int i = 0; i < 3; i++) {
            server.expect(once(), requestTo(BASE + "/envs/env-1/dictionary"))
                    .andRespond(withServerError());
        }

        GameEngine engine = factory.create("zork1");

        assertThatThrownBy(engine::getDictionary)
                .isInstanceOf(GameEngineException.class)
                .hasMessageContaining("dictionary");
        server.verify();
    }

    @Test
    void stateSnapshot_replayedVerbatim() throws Exception {
        String stateJson = "{\"ram\": [1, 2, 3], \"pc\": 4242, \"rng\": \"seed\"}";
        expectCreate();
        server.expect(once(), requestTo(BASE + "/envs/env-1/state"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(stateJson, MediaType.APPLICATION_JSON));
        server.expect(once(), requestTo(BASE + "/envs/env-1/state"))
                .andExpect(method(HttpMethod.PUT))
                .andExpect(content().json(stateJson, true))
                .andRespond(withSuccess());

        GameEngine engine = factory.create("zork1");
        EngineSnapshot snapshot = engine.getState();
        engine.setState(snapshot);

        assertThat(snapshot.payload()).isEqualTo(new ObjectMapper().readTree(stateJson));
        server.verify();
    }

    @Test
    void close_releasesEnvironment_andSwallowsFailure() {
        expectCreate();
        server.expect(once(), requestTo(BASE + "/envs/env-1"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withServerError());

        factory.create("zork1").close();

        server.verify();
    }

    @Test
    void availableGames_listsGames() {
        server.expect(once(), requestTo(BASE + "/games"))
                .andRespond(withSuccess("[\"zork1\", \"lostpig\", \"enchanter\"]", MediaType.APPLICATION_JSON));

        assertThat(factory.availableGames()).containsExactly("zork1", "lostpig", "enchanter");
    }

    @Test
    void create_missingEnvId_rejected() {
        server.expect(once(), requestTo(BASE + "/envs"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> factory.create("zork1"))
                .isInstanceOf(GameEngineException.class)
                .hasMessageContaining("zork1");
    }

    private void expectCreate() {
        server.expect(once(), requestTo(BASE + "/envs"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"game\": \"zork1\"}"))
                .andRespond(withSuccess("{\"envId\": \"env-1\", \"transition\": " + TRANSITION_JSON + "}",
                        MediaType.APPLICATION_JSON));
    }
}
