package com.livedesk.relay.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.livedesk.relay")
@EnableScheduling
public class LiveDeskApplication {
    public static void main(String[] args) {
        SpringApplication.run(LiveDeskApplication.class, args);
    }
}
