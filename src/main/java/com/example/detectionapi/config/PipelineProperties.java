package com.example.detectionapi.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    @Positive
    private int warmupWidth = 256;
    @Positive
    private int warmupHeight = 256;
    private long warmupSeed = 42L;
    private boolean healthRecompute = true;

    public int getWarmupWidth() {
        return warmupWidth;
    }

    public void setWarmupWidth(int warmupWidth) {
        this.warmupWidth = warmupWidth;
    }

    public int getWarmupHeight() {
        return warmupHeight;
    }

    public void setWarmupHeight(int warmupHeight) {
        this.warmupHeight = warmupHeight;
    }

    public long getWarmupSeed() {
        return warmupSeed;
    }

    public void setWarmupSeed(long warmupSeed) {
        this.warmupSeed = warmupSeed;
    }

    public boolean isHealthRecompute() {
        return healthRecompute;
    }

    public void setHealthRecompute(boolean healthRecompute) {
        this.healthRecompute = healthRecompute;
    }
}
