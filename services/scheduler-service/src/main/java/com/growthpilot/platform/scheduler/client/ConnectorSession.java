package com.growthpilot.platform.scheduler.client;

import com.growthpilot.platform.scheduler.dto.AccountMetrics;
import com.growthpilot.platform.scheduler.dto.PlatformAccount;
import com.growthpilot.platform.scheduler.dto.PostResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
class ConnectorSession implements PlatformSession {

    private static final String BASE_PATH = "/api/v1/x";

    private final UUID userId;
    private final WebClient client;
    private final Duration timeout;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ConnectorSession(UUID userId, WebClient client, Duration timeout) {
        this.userId = userId;
        this.client = client;
        this.timeout = timeout;
    }

    @Override
    public PostResult postTweet(String text, List<String> mediaUrls) {
        return publish("/tweets", Map.of(
                "text", text,
                "mediaUrls", mediaUrls != null ? mediaUrls : List.of()
        ));
    }

    @Override
    public PostResult postThread(List<String> segments, List<String> mediaUrls) {
        return publish("/threads", Map.of(
                "segments", segments,
                "mediaUrls", mediaUrls != null ? mediaUrls : List.of()
        ));
    }

    @Override
    public PostResult reply(String tweetId, String text) {
        return publish("/tweets", Map.of(
                "text", text,
                "inReplyToTweetId", tweetId
        ));
    }

    @Override
    public String lookupAccountId(String username) {
        PlatformAccount account;
        try {
            account = execute(client.get()
                    .uri(BASE_PATH + "/users/by-username/{username}", username)
                    .retrieve()
                    .bodyToMono(PlatformAccount.class));
        } catch (PlatformClientException e) {
            if (e.getHttpStatus() != null && e.getHttpStatus() == 404) {
                return null;
            }
            throw e;
        }
        return account != null ? account.getId() : null;
    }

    @Override
    public void follow(String accountId) {
        send(client.post().uri(BASE_PATH + "/follows").bodyValue(Map.of("targetUserId", accountId)));
    }

    @Override
    public void unfollow(String accountId) {
        send(client.delete().uri(BASE_PATH + "/follows/{accountId}", accountId));
    }

    @Override
    public void like(String tweetId) {
        send(client.post().uri(BASE_PATH + "/likes").bodyValue(Map.of("tweetId", tweetId)));
    }

    @Override
    public void unlike(String tweetId) {
        send(client.delete().uri(BASE_PATH + "/likes/{tweetId}", tweetId));
    }

    @Override
    public void retweet(String tweetId) {
        send(client.post().uri(BASE_PATH + "/retweets").bodyValue(Map.of("tweetId", tweetId)));
    }

    @Override
    public void unretweet(String tweetId) {
        send(client.delete().uri(BASE_PATH + "/retweets/{tweetId}", tweetId));
    }

    @Override
    public AccountMetrics accountMetrics() {
        return execute(client.get()
                .uri(BASE_PATH + "/account/metrics")
                .retrieve()
                .bodyToMono(AccountMetrics.class));
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.debug("Closed platform session for user {}", userId);
        }
    }

    private PostResult publish(String path, Map<String, Object> body) {
        PostResult result = execute(client.post()
                .uri(BASE_PATH + path)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(PostResult.class));
        if (result == null) {
            throw new PlatformClientException(FailureClass.TRANSIENT, "EMPTY_RESPONSE",
                    "Platform connector returned no body");
        }
        if (!result.isSuccess()) {
            throw PlatformClientException.fromErrorCode(result.getErrorCode(), result.getErrorMessage());
        }
        return result;
    }

    private void send(WebClient.RequestHeadersSpec<?> request) {
        execute(request.retrieve().toBodilessEntity());
    }

    private <T> T execute(Mono<T> request) {
        if (closed.get()) {
            throw new IllegalStateException("Platform session for user " + userId + " is closed");
        }
        try {
            return request.timeout(timeout).block();
        } catch (WebClientResponseException e) {
            throw PlatformClientException.fromStatus(e.getStatusCode().value(),
                    e.getResponseBodyAsString(), retryAfter(e.getHeaders()), e);
        } catch (WebClientRequestException e) {
            throw new PlatformClientException(FailureClass.TRANSIENT, "CONNECTION_ERROR",
                    e.getMessage(), null, null, e);
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                throw new PlatformClientException(FailureClass.TRANSIENT, "TIMEOUT",
                        "Platform request timed out after " + timeout, null, null, e);
            }
            throw e;
        }
    }

    private static Duration retryAfter(HttpHeaders headers) {
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null) {
            return null;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After header: {}", value);
            return null;
        }
    }
}
