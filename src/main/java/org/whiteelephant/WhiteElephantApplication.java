package org.whiteelephant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling  // watchdog du listener de notifications
public class WhiteElephantApplication {
    public static void main(String[] args) {
        SpringApplication.run(WhiteElephantApplication.class, args);
    }
}
