package com.growthpilot.platform.scheduler.entity;

public enum TargetType {
    ACCOUNT,
    TWEET
}
