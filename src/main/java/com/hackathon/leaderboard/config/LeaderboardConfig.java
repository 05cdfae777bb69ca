package com.hackathon.leaderboard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class LeaderboardConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
