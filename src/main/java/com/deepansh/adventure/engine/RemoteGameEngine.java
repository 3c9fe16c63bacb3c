package com.deepansh.adventure.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Engine backed by one environment on the game host sidecar.
 *
 * Error handling strategy:
 *
 * | Call                              | Retried | On failure                 |
 * |-----------------------------------|---------|----------------------------|
 * | valid-actions, dictionary, state  | yes     | GameEngineException        |
 * | reset, step, set-state            | no      | GameEngineException        |
 * | close                             | no      | logged, never thrown       |
 *
 * Steps and state restores change the game, so replaying them after a timeout
 * could apply an action twice.
 */
@Slf4j
public class RemoteGameEngine implements GameEngine {

    private static final ParameterizedTypeReference<List<String>> STRING_LIST =
            new ParameterizedTypeReference<>() {};

    private final RestClient restClient;
    private final Retry readRetry;
    private final String envId;
    private final String gameName;

    RemoteGameEngine(RestClient restClient, Retry readRetry, String envId, String gameName) {
        this.restClient = restClient;
        this.readRetry = readRetry;
        this.envId = envId;
        this.gameName = gameName;
    }

    public String getEnvId() {
        return envId;
    }

    @Override
    public Transition reset() {
        return call("reset", () -> restClient.post()
                .uri("/envs/{id}/reset", envId)
                .retrieve()
                .body(Transition.class));
    }

    @Override
    public Transition step(String action) {
        log.debug("Engine step [env={}, action='{}']", envId, action);
        return call("step", () -> restClient.post()
                .uri("/envs/{id}/step", envId)
                .body(Map.of("action", action))
                .retrieve()
                .body(Transition.class));
    }

    @Override
    public List<String> getValidActions() {
        return read("valid-actions", () -> restClient.get()
                .uri("/envs/{id}/valid-actions", envId)
                .retrieve()
                .body(STRING_LIST));
    }

    @Override
    public List<String> getDictionary() {
        return read("dictionary", () -> restClient.get()
                .uri("/envs/{id}/dictionary", envId)
                .retrieve()
                .body(STRING_LIST));
    }

    @Override
    public EngineSnapshot getState() {
        JsonNode payload = read("state", () -> restClient.get()
                .uri("/envs/{id}/state", envId)
                .retrieve()
                .body(JsonNode.class));
        return new EngineSnapshot(payload);
    }

    @Override
    public void setState(EngineSnapshot snapshot) {
        call("set-state", () -> restClient.put()
                .uri("/envs/{id}/state", envId)
                .body(snapshot.payload())
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public void close() {
        try {
            restClient.delete()
                    .uri("/envs/{id}", envId)
                    .retrieve()
                    .toBodilessEntity();
            log.info("Released engine environment [env={}, game={}]", envId, gameName);
        } catch (RestClientException e) {
            log.warn("Failed to release engine environment [env={}]: {}", envId, e.getMessage());
        }
    }

    private <T> T read(String operation, Supplier<T> request) {
        return call(operation, () -> readRetry.executeSupplier(request));
    }

    private <T> T call(String operation, Supplier<T> request) {
        T result;
        try {
            result = request.get();
        } catch (RestClientException e) {
            log.error("Engine {} failed [env={}, game={}]: {}", operation, envId, gameName, e.getMessage());
            throw new GameEngineException("engine " + operation + " failed: " + e.getMessage(), e);
        }
        if (result == null) {
            throw new GameEngineException("engine " + operation + " returned an empty body");
        }
        return result;
    }
}
