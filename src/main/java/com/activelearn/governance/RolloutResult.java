package com.activelearn.governance;

public record RolloutResult(String agent, RolloutStatus status, int percent, CanaryCheck check, String message) {
}
