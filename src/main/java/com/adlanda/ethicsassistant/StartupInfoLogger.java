package com.adlanda.ethicsassistant;

import com.adlanda.ethicsassistant.config.AssistantProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2) // Run after IngestionRunner
public class StartupInfoLogger implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupInfoLogger.class);

    private final AssistantProperties properties;

    @Value("${server.port:8080}")
    private int port;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String version;

    public StartupInfoLogger(AssistantProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

            AI Ethics Assistant v{}
            Documents: {} ({}*{})
            Index: {} collection '{}'

            API Endpoints:
              GET  http://localhost:{}/api/v1
              POST http://localhost:{}/api/v1/chat
              POST http://localhost:{}/api/v1/ingest
              GET  http://localhost:{}/api/v1/rag/health

            Health:
              GET  http://localhost:{}/actuator/health
            """,
            version,
            properties.getStorage().getRoot(), properties.getStorage().getPrefix(), properties.getStorage().getSuffix(),
            properties.getIndex().getType(), properties.getIndex().getCollection(),
            port, port, port, port, port
        );
    }
}
