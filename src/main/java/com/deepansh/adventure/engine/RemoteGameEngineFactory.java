package com.deepansh.adventure.engine;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;

/**
 * Starts environments on the game host sidecar and hands out one
 * {@link RemoteGameEngine} per environment.
 */
@Component
@Slf4j
public class RemoteGameEngineFactory implements GameEngineFactory {

    static final String RETRY_NAME = "gameEngine";

    private final RestClient restClient;
    private final Retry readRetry;

    public RemoteGameEngineFactory(RestClient.Builder engineRestClientBuilder, RetryRegistry retryRegistry) {
        this.restClient = engineRestClientBuilder.build();
        this.readRetry = retryRegistry.retry(RETRY_NAME);
    }

    @Override
    public GameEngine create(String gameName) {
        CreatedEnvironment created;
        try {
            created = restClient.post()
                    .uri("/envs")
                    .body(Map.of("game", gameName))
                    .retrieve()
                    .body(CreatedEnvironment.class);
        } catch (RestClientException e) {
            throw new GameEngineException("could not start game '" + gameName + "': " + e.getMessage(), e);
        }
        if (created == null || created.envId() == null || created.envId().isBlank()) {
            throw new GameEngineException("engine host returned no environment id for game '" + gameName + "'");
        }

        log.info("Started engine environment [env={}, game={}]", created.envId(), gameName);
        return new RemoteGameEngine(restClient, readRetry, created.envId(), gameName);
    }

    @Override
    public List<String> availableGames() {
        try {
            List<String> games = readRetry.executeSupplier(() -> restClient.get()
                    .uri("/games")
                    .retrieve()
                    .body(new ParameterizedTypeReference<List<String>>() {}));
            return games != null ? games : List.of();
        } catch (RestClientException e) {
            throw new GameEngineException("could not list games: " + e.getMessage(), e);
        }
    }

    /** Body of {@code POST /envs}. The opening transition is ignored; sessions call reset themselves. */
    public record CreatedEnvironment(String envId, Transition transition) {}
}
