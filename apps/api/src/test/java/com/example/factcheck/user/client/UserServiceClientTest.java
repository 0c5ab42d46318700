package com.example.factcheck.user.client;

import com.example.factcheck.config.properties.UserServiceProperties;
import com.example.factcheck.exception.ApiException;
import com.example.factcheck.user.exception.UserNotFoundException;
import com.example.factcheck.user.model.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("UserServiceClient")
class UserServiceClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();
    private HttpStatus status;
    private String body;

    @BeforeEach
    void setUp() {
        requests.clear();
        status = HttpStatus.OK;
        body = "{\"id\":7,\"username\":\"captain\",\"reputation\":42}";
    }

    private UserServiceClient client(Duration cacheTtl) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://users.test")
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new UserServiceClient(webClient,
                new UserServiceProperties("http://users.test", Duration.ofSeconds(1), cacheTtl, 100));
    }

    @Nested
    @DisplayName("loadById")
    class LoadById {

        @Test
        @DisplayName("should map the user's id and reputation")
        void shouldMapUser() {
            StepVerifier.create(client(Duration.ZERO).loadById(7L))
                    .expectNext(new User(7L, 42))
                    .verifyComplete();

            assertThat(requests).hasSize(1);
            assertThat(requests.get(0).url().toString()).isEqualTo("http://users.test/users/7");
        }

        @Test
        @DisplayName("should fail with UserNotFoundException on 404")
        void shouldFailOnNotFound() {
            status = HttpStatus.NOT_FOUND;
            body = "";

            StepVerifier.create(client(Duration.ZERO).loadById(8L))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(UserNotFoundException.class);
                        assertThat(((UserNotFoundException) error).getUserId()).isEqualTo(8L);
                    })
                    .verify();
        }

        @Test
        @DisplayName("should fail with ApiException on server errors")
        void shouldFailOnServerError() {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            body = "{\"error\":\"boom\"}";

            StepVerifier.create(client(Duration.ZERO).loadById(7L))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(ApiException.class);
                        assertThat(((ApiException) error).getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
                        assertThat(((ApiException) error).getServiceName()).isEqualTo("UserService");
                    })
                    .verify();
        }

        @Test
        @DisplayName("should fail with ApiException when the reputation is missing")
        void shouldFailOnMissingReputation() {
            body = "{\"id\":7,\"username\":\"captain\"}";

            StepVerifier.create(client(Duration.ZERO).loadById(7L))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(ApiException.class);
                        assertThat(((ApiException) error).getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
                        assertThat(error.getMessage()).contains("no reputation");
                    })
                    .verify();
        }

        @Test
        @DisplayName("should keep a negative reputation")
        void shouldKeepNegativeReputation() {
            body = "{\"id\":7,\"reputation\":-30}";

            StepVerifier.create(client(Duration.ZERO).loadById(7L))
                    .expectNext(new User(7L, -30))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("caching")
    class Caching {

        @Test
        @DisplayName("should serve repeated loads from cache")
        void shouldServeFromCache() {
            UserServiceClient client = client(Duration.ofMinutes(1));

            client.loadById(7L).block();
            User second = client.loadById(7L).block();

            assertThat(second).isEqualTo(new User(7L, 42));
            assertThat(requests).hasSize(1);
        }

        @Test
        @DisplayName("should reload after eviction")
        void shouldReloadAfterEviction() {
            UserServiceClient client = client(Duration.ofMinutes(1));

            client.loadById(7L).block();
            client.evict(7L);
            client.loadById(7L).block();

            assertThat(requests).hasSize(2);
        }

        @Test
        @DisplayName("should always call the service when caching is disabled")
        void shouldNotCacheWhenDisabled() {
            UserServiceClient client = client(Duration.ZERO);

            client.loadById(7L).block();
            client.loadById(7L).block();

            assertThat(requests).hasSize(2);
        }

        @Test
        @DisplayName("should not cache missing users")
        void shouldNotCacheMissingUsers() {
            status = HttpStatus.NOT_FOUND;
            body = "";
            UserServiceClient client = client(Duration.ofMinutes(1));

            StepVerifier.create(client.loadById(9L)).expectError(UserNotFoundException.class).verify();
            StepVerifier.create(client.loadById(9L)).expectError(UserNotFoundException.class).verify();

            assertThat(requests).hasSize(2);
        }
    }
}
