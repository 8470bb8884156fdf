package org.iceforge.ocient.connector.service;

import org.iceforge.ocient.connector.config.OcientProperties;
import org.iceforge.ocient.connector.model.QueryOutcome;
import org.iceforge.ocient.connector.web.ExecuteRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Objects;

@Component
public class OcientClient {
    private static final Logger logger = LoggerFactory.getLogger(OcientClient.class);

    private final WebClient webClient;
    private final OcientProperties props;
    private final CollectionDecoder decoder;

    public OcientClient(WebClient ocientWebClient, OcientProperties props, CollectionDecoder decoder) {
        this.webClient = Objects.requireNonNull(ocientWebClient);
        this.props = Objects.requireNonNull(props);
        this.decoder = Objects.requireNonNull(decoder);
    }

    public Mono<QueryOutcome> execute(String statement) {
        return execute(props.getDatabase(), statement);
    }

    /**
     * Runs one statement against the execute endpoint in collection format.
     *
     * <p>The returned Mono always completes with an outcome; transport, protocol and remote SQL
     * failures are reported through it rather than as error signals. Cancelling the subscription
     * aborts the exchange. Nothing is retried.
     */
    public Mono<QueryOutcome> execute(String database, String statement) {
        ExecuteRequest body = new ExecuteRequest(database, statement);
        return Mono.defer(() -> {
                    logger.debug("POST {}{} database={} statement={}", props.baseUrl(), props.getExecutePath(), database, statement);
                    return webClient.post()
                            .uri(props.getExecutePath())
                            .contentType(MediaType.APPLICATION_JSON)
                            .accept(MediaType.APPLICATION_JSON)
                            .body(BodyInserters.fromValue(body))
                            .exchangeToMono(resp -> resp.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .map(text -> decoder.decode(resp.statusCode(), text)));
                })
                .onErrorResume(Exception.class, e -> {
                    if (isBodyTooLarge(e)) {
                        logger.warn("Response from {} exceeded ocient.max-response-size ({})", props.baseUrl(), props.getMaxResponseSize());
                        return Mono.just(QueryOutcome.parseFailure("Response body exceeds the configured limit of "
                                + props.getMaxResponseSize() + ": " + describe(e)));
                    }
                    logger.warn("Execute request to {} failed: {}", props.baseUrl(), e.toString());
                    return Mono.just(QueryOutcome.transportFailure("Error executing query: " + describe(e)));
                })
                .doOnNext(outcome -> {
                    if (outcome.isSuccess()) {
                        logger.debug("query_id={} rows={}", outcome.queryId(), outcome.rows().size());
                    } else {
                        logger.info("Statement failed kind={} message={}", outcome.errorKind(), outcome.message());
                    }
                });
    }

    private static boolean isBodyTooLarge(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof DataBufferLimitException) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String msg = e.getMessage();
        if (root != e && root.getMessage() != null) {
            msg = msg == null ? root.getMessage() : msg + " (" + root.getMessage() + ")";
        }
        return msg == null ? e.getClass().getSimpleName() : msg;
    }
}
