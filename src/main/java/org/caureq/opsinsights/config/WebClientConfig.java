package org.caureq.opsinsights.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import javax.net.ssl.SSLException;

@Slf4j
@Configuration
public class WebClientConfig {

    @Bean
    @ConditionalOnProperty(prefix = "proxmox", name = "enabled", havingValue = "true")
    public WebClient proxmoxWebClient(ProxmoxProps props) {
        HttpClient http = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) props.timeout().toMillis())
                .responseTimeout(props.timeout());
        if (props.insecureTls()) {
            // self-signed PVE certificates; lab clusters only
            log.warn("[Proxmox] TLS certificate verification disabled");
            http = http.secure(sslSpec -> {
                try {
                    sslSpec.sslContext(
                            SslContextBuilder.forClient()
                                    .trustManager(InsecureTrustManagerFactory.INSTANCE)
                                    .build()
                    );
                } catch (SSLException e) {
                    throw new IllegalStateException("Failed to build SSL context", e);
                }
            });
        }

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(http))
                .exchangeStrategies(
                        ExchangeStrategies.builder()
                                .codecs(c -> c.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                                .build()
                )
                .build();
    }
}
