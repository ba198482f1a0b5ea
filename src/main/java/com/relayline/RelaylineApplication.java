package com.relayline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

/**
 * Main application class for Relayline - chat orchestration across interchangeable LLM providers.
 */
@SpringBootApplication
@EnableCaching
public class RelaylineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelaylineApplication.class, args);
    }
}
