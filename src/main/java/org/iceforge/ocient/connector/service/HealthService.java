package org.iceforge.ocient.connector.service;

import org.iceforge.ocient.connector.config.OcientProperties;
import org.iceforge.ocient.connector.model.ErrorKind;
import org.iceforge.ocient.connector.model.HealthResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.util.Objects;

@Service
public class HealthService {
    private static final Logger logger = LoggerFactory.getLogger(HealthService.class);

    static final String PROBE_SQL = "SELECT 1";

    private final OcientProperties props;
    private final OcientClient client;

    public HealthService(OcientProperties props, OcientClient client) {
        this.props = Objects.requireNonNull(props);
        this.client = Objects.requireNonNull(client);
    }

    /**
     * Checks the connection settings, then runs a trivial statement.
     */
    public Mono<HealthResult> check() {
        String missing = missingSetting();
        if (missing != null) {
            return Mono.just(HealthResult.error(missing));
        }

        return client.execute(PROBE_SQL).map(outcome -> {
            if (outcome.isSuccess()) {
                logger.info("Connection test succeeded against {}", props.baseUrl());
                return HealthResult.ok("Data source is working");
            }
            String msg = outcome.errorKind() == ErrorKind.REMOTE_SQL
                    ? "Connection test failed: " + outcome.status().reason() + " (SQL state: " + outcome.status().sqlState() + ")"
                    : "Connection test failed: " + outcome.message();
            logger.warn(msg);
            return HealthResult.error(msg);
        });
    }

    private String missingSetting() {
        if (!StringUtils.hasText(props.getHost())) return "Host is missing";
        if (props.getPort() == 0) return "Port is missing";
        if (!StringUtils.hasText(props.getDatabase())) return "Database is missing";
        if (!StringUtils.hasText(props.getUsername())) return "Username is missing";
        if (!StringUtils.hasText(props.getPassword())) return "Password is missing";
        return null;
    }
}
