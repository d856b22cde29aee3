package org.blackjacksim;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BlackjackSimApplication {
    public static void main(String[] args) {
        SpringApplication.run(BlackjackSimApplication.class, args);
    }
}
