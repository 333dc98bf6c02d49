package com.example.governance.degradation;

public record LevelRecommendation(int level, double confidence, String reasoning) {
}
