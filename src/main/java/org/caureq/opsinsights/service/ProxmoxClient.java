package org.caureq.opsinsights.service;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.opsinsights.config.ProxmoxProps;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/** Read-only access to the Proxmox VE API, used to take inventory snapshots. */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "proxmox", name = "enabled", havingValue = "true")
public class ProxmoxClient {

    private final ProxmoxProps props;
    private final WebClient proxmoxWebClient;

    @PostConstruct
    void checkToken() {
        var hdr = authHeader();
        var masked = hdr.replaceAll("=(.{4}).+$", "=$1********");
        log.info("[Proxmox] {} auth header = {}", props.baseUrl(), masked);
    }

    private String authHeader() {
        return "PVEAPIToken=%s=%s".formatted(props.tokenId(), props.tokenSecret());
    }

    /** Central error mapping; PVE proxy errors (596) come through as non-2xx too. */
    private <T> Mono<T> handle(String path, WebClient.ResponseSpec spec, Class<T> bodyType) {
        return spec
                .onStatus(s -> !s.is2xxSuccessful(),
                        r -> r.bodyToMono(String.class).defaultIfEmpty("")
                                .map(body -> new ProxmoxApiException(r.statusCode().value(), path, body)))
                .bodyToMono(bodyType)
                .timeout(props.timeout())
                .retryWhen(Retry.backoff(1, Duration.ofMillis(400)).jitter(0.4)
                        .filter(ProxmoxClient::retryable)
                        .onRetryExhaustedThrow((retry, signal) -> signal.failure()));
    }

    private static boolean retryable(Throwable ex) {
        if (ex instanceof ProxmoxApiException pe) return pe.retryable();
        return ex instanceof IOException || ex instanceof TimeoutException;
    }

    /** Guests of the whole cluster ({@code data} array of /cluster/resources?type=vm). */
    public JsonNode clusterVms() {
        var path = "/cluster/resources?type=vm";
        var spec = proxmoxWebClient.get().uri(props.baseUrl() + path)
                .header("Authorization", authHeader())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve();
        return handle(path, spec, JsonNode.class).map(j -> j.path("data")).block();
    }
}
