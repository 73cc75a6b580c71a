package com.swing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SwingSignalApplication {

    private static final Logger log = LoggerFactory.getLogger(SwingSignalApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(SwingSignalApplication.class, args);
        log.info("Swing Signal Service started.");
        log.info("Stocks API:   GET http://localhost:8080/api/stocks?direction=LONG&sort=confidence");
        log.info("One symbol:   GET http://localhost:8080/api/stock/RELIANCE");
        log.info("Health:       GET http://localhost:8080/api/health");
    }
}
