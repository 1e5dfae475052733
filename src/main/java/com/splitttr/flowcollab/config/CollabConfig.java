package com.splitttr.flowcollab.config;

import com.splitttr.flowcollab.model.SessionSettings;

import java.time.Duration;

public record CollabConfig(
    int queueDepth,
    long retainedWindow,
    double positionGap,
    Duration idleTimeout,
    SessionSettings defaultSettings
) {}
