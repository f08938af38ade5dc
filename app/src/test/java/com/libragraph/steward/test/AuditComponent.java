package com.libragraph.steward.test;

import com.libragraph.steward.core.component.ComponentContext;
import com.libragraph.steward.core.component.ManagedComponent;
import jakarta.enterprise.context.ApplicationScoped;

/** Optional component: never reports, must not hold up readiness. */
@ApplicationScoped
public class AuditComponent implements ManagedComponent {

    @Override
    public String componentId() {
        return "audit";
    }

    @Override
    public void start(ComponentContext context) {
        // nothing to initialize
    }
}
