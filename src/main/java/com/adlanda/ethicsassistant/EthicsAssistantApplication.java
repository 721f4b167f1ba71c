package com.adlanda.ethicsassistant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * AI Ethics Assistant - Main Application
 *
 * Answers natural-language questions about AI ethics and regulation from a curated
 * document collection, citing the source documents it drew on.
 *
 * This application uses:
 * - Spring Boot 3.4 with Java 17
 * - Spring AI for embeddings, chat generation and Tika text extraction
 * - PGVector for vector storage and similarity search
 *
 * @see <a href="https://docs.spring.io/spring-ai/reference/">Spring AI Documentation</a>
 */
@SpringBootApplication
public class EthicsAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(EthicsAssistantApplication.class, args);
    }
}
