package com.libragraph.steward.test;

import com.libragraph.steward.core.component.AbstractManagedComponent;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Test-only component that must initialize before the process becomes ACTIVE.
 */
@ApplicationScoped
public class CatalogComponent extends AbstractManagedComponent {

    @Override
    public String componentId() {
        return "catalog";
    }

    @Override
    public boolean initRequired() {
        return true;
    }

    @Override
    protected void doStart() {
        log.info("Catalog loaded");
    }
}
