package com.example.giveaway_system.platform;

public record SentMessage(String id, String url) {
}
