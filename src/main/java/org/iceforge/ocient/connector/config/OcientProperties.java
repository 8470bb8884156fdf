package org.iceforge.ocient.connector.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "ocient")
public class OcientProperties {

    /**
     * URL scheme of the execute endpoint. Production deployments always use https.
     */
    @NotBlank
    private String scheme = "https";

    /**
     * Host of the Ocient REST endpoint. Left blank until configured; the health check reports it.
     */
    private String host = "";

    @Min(0)
    @Max(65535)
    private int port = 443;

    /**
     * Database every statement runs against.
     */
    private String database = "";

    private String username = "";

    private String password = "";

    /**
     * Skip TLS certificate verification. Only honored for https.
     */
    private boolean insecureSkipVerify = false;

    @NotBlank
    private String executePath = "/v1/execute";

    @NotNull
    private Duration responseTimeout = Duration.ofSeconds(30);

    /**
     * Largest response body buffered for one statement.
     */
    @NotNull
    private DataSize maxResponseSize = DataSize.ofMegabytes(16);

    /**
     * Report cells that cannot be coerced to their column type instead of substituting zero values.
     */
    private boolean strictCoercion = false;

    public String baseUrl() {
        return scheme + "://" + host + ":" + port;
    }

    public String getScheme() {
        return scheme;
    }

    public void setScheme(String scheme) {
        this.scheme = scheme;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getDatabase() {
        return database;
    }

    public void setDatabase(String database) {
        this.database = database;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public boolean isInsecureSkipVerify() {
        return insecureSkipVerify;
    }

    public void setInsecureSkipVerify(boolean insecureSkipVerify) {
        this.insecureSkipVerify = insecureSkipVerify;
    }

    public String getExecutePath() {
        return executePath;
    }

    public void setExecutePath(String executePath) {
        this.executePath = executePath;
    }

    public Duration getResponseTimeout() {
        return responseTimeout;
    }

    public void setResponseTimeout(Duration responseTimeout) {
        this.responseTimeout = responseTimeout;
    }

    public DataSize getMaxResponseSize() {
        return maxResponseSize;
    }

    public void setMaxResponseSize(DataSize maxResponseSize) {
        this.maxResponseSize = maxResponseSize;
    }

    public boolean isStrictCoercion() {
        return strictCoercion;
    }

    public void setStrictCoercion(boolean strictCoercion) {
        this.strictCoercion = strictCoercion;
    }
}
