package com.dealtracker.poller;

import com.dealtracker.poller.application.config.DealPollerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(DealPollerProperties.class)
public class DealPollerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DealPollerApplication.class, args);
    }
}
