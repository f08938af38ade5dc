package com.libragraph.steward.api;

import com.libragraph.steward.core.bootstrap.ComponentSupervisor;
import com.libragraph.steward.core.init.InitReport;
import com.libragraph.steward.types.LifecycleState;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Path("/api/lifecycle")
@Produces(MediaType.APPLICATION_JSON)
public class LifecycleResource {

    @Inject
    ComponentSupervisor supervisor;

    @GET
    public Map<String, String> state() {
        LifecycleState state = supervisor.state();
        Map<String, String> body = new LinkedHashMap<>();
        body.put("state", state.label());
        if (state == LifecycleState.FAILED) {
            supervisor.tracker().firstFailure().ifPresent(report -> {
                body.put("failedComponent", report.componentId());
                body.put("reason", report.reason());
            });
        }
        return body;
    }

    /** Initialization reports of every known component, ordered by id. */
    @GET
    @Path("/components")
    public List<ComponentView> components() {
        return supervisor.tracker().reports().stream()
                .map(ComponentView::of)
                .toList();
    }

    public record ComponentView(String componentId, boolean required, String status, String reason,
                                String reportedAt) {

        static ComponentView of(InitReport report) {
            return new ComponentView(
                    report.componentId(),
                    report.required(),
                    report.status().name().toLowerCase(),
                    report.reason(),
                    report.reportedAt() != null ? report.reportedAt().toString() : null);
        }
    }
}
