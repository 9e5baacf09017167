package com.example.giveaway_system.event;

import com.example.giveaway_system.domain.Giveaway;

public record GiveawayCancelledEvent(Giveaway giveaway) {}
