package org.iceforge.ocient.connector.config;

import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.iceforge.ocient.connector.service.FrameBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import javax.net.ssl.SSLException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

@Configuration
@EnableConfigurationProperties(OcientProperties.class)
public class AppConfig {

    @Bean
    public WebClient ocientWebClient(OcientProperties props) {
        HttpClient http = HttpClient.create().responseTimeout(props.getResponseTimeout());
        if (props.isInsecureSkipVerify() && "https".equalsIgnoreCase(props.getScheme())) {
            SslContext insecure = insecureSslContext();
            http = http.secure(ssl -> ssl.sslContext(insecure));
        }

        int maxInMemorySize = maxInMemorySize(props);
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(props.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(http))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(maxInMemorySize));

        if (StringUtils.hasText(props.getUsername())) {
            builder.defaultHeaders(h -> h.setBasicAuth(props.getUsername(), Objects.requireNonNullElse(props.getPassword(), ""), StandardCharsets.UTF_8));
        }
        return builder.build();
    }

    @Bean
    public FrameBuilder frameBuilder(OcientProperties props) {
        return new FrameBuilder(props.isStrictCoercion());
    }

    private static int maxInMemorySize(OcientProperties props) {
        long bytes = props.getMaxResponseSize().toBytes();
        if (bytes > Integer.MAX_VALUE) {
            throw new IllegalStateException("ocient.max-response-size must be below 2GB, was " + props.getMaxResponseSize());
        }
        return (int) bytes;
    }

    private static SslContext insecureSslContext() {
        try {
            return SslContextBuilder.forClient()
                    .trustManager(InsecureTrustManagerFactory.INSTANCE)
                    .build();
        } catch (SSLException e) {
            throw new IllegalStateException("Failed to build TLS context with verification disabled", e);
        }
    }
}
