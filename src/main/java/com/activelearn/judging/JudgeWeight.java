package com.activelearn.judging;

import java.time.Instant;

public record JudgeWeight(String agent, String judgeId, double weight, Instant updatedAt) {
}
