package com.hackathon.leaderboard.model;

public enum SubscriberState {
    CONNECTING,
    STREAMING,
    DISCONNECTED,
    STOPPED
}
