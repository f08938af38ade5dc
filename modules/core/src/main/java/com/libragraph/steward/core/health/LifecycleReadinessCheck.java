package com.libragraph.steward.core.health;

import com.libragraph.steward.core.bootstrap.ComponentSupervisor;
import com.libragraph.steward.core.init.InitReport;
import com.libragraph.steward.types.LifecycleState;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import java.util.Optional;

@Readiness
@ApplicationScoped
public class LifecycleReadinessCheck implements HealthCheck {

    @Inject
    ComponentSupervisor supervisor;

    @Override
    public HealthCheckResponse call() {
        LifecycleState state = supervisor.state();
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("lifecycle")
                .status(state == LifecycleState.ACTIVE)
                .withData("state", state.label());

        if (state == LifecycleState.FAILED) {
            Optional<InitReport> failure = supervisor.tracker().firstFailure();
            failure.ifPresent(report -> builder
                    .withData("failedComponent", report.componentId())
                    .withData("reason", String.valueOf(report.reason())));
        }
        return builder.build();
    }
}
