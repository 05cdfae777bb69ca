package com.hackathon.leaderboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LiveLeaderboardApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiveLeaderboardApplication.class, args);
    }
}
