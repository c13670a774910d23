/*
 * どこで: Tariff アプリのインフラ設定
 * 何を: NATS Connection と JetStream を Spring 管理下に置く
 * なぜ: 監査ログ送信と stream 初期化が同一接続を再利用するため
 */
package com.insurancecost.tariff.config;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsConfig {

    private static final int DEFAULT_CONNECTION_TIMEOUT_SECONDS = 5;

    @Bean(destroyMethod = "close")
    public Connection natsConnection(NatsProperties properties) throws IOException, InterruptedException {
        int timeoutSeconds = properties.connectionTimeout() == null
                ? DEFAULT_CONNECTION_TIMEOUT_SECONDS
                : properties.connectionTimeout();
        Options options = new Options.Builder()
                .server(properties.url())
                .connectionTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
        return Nats.connect(options);
    }

    @Bean
    public JetStream jetStream(Connection natsConnection) throws IOException {
        return natsConnection.jetStream();
    }
}
