package com.example.giveaway_system.platform;

public record PlatformUser(String id, boolean bot) {
}
