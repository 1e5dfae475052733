package com.splitttr.flowcollab.config;

import com.splitttr.flowcollab.model.Role;
import com.splitttr.flowcollab.model.SessionSettings;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

@ApplicationScoped
public class CollabConfigProducer {

    @ConfigProperty(name = "collab.pipeline.queue-depth", defaultValue = "256")
    int queueDepth;

    @ConfigProperty(name = "collab.pipeline.retained-window", defaultValue = "500")
    long retainedWindow;

    @ConfigProperty(name = "collab.transform.position-gap", defaultValue = "24")
    double positionGap;

    @ConfigProperty(name = "collab.session.idle-timeout", defaultValue = "PT5M")
    Duration idleTimeout;

    @ConfigProperty(name = "collab.session.default-max-participants", defaultValue = "10")
    int defaultMaxParticipants;

    @ConfigProperty(name = "collab.session.default-allowed-roles", defaultValue = "owner,editor,viewer")
    List<String> defaultAllowedRoles;

    @ConfigProperty(name = "collab.session.default-auto-save", defaultValue = "true")
    boolean defaultAutoSave;

    @Produces
    @Singleton
    CollabConfig collabConfig() {
        var roles = defaultAllowedRoles.stream().map(Role::fromWire).collect(Collectors.toSet());
        return new CollabConfig(queueDepth, retainedWindow, positionGap, idleTimeout,
            new SessionSettings(roles, defaultMaxParticipants, defaultAutoSave));
    }

    @Produces
    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }
}
