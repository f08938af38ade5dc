package com.libragraph.steward.test;

import com.libragraph.steward.core.component.AbstractManagedComponent;
import com.libragraph.steward.core.component.DependsOn;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Duration;
import java.util.Optional;

/**
 * Test-only component that {@code @DependsOn(CatalogComponent)}, so it is stopped first.
 */
@ApplicationScoped
@DependsOn(CatalogComponent.class)
public class IndexerComponent extends AbstractManagedComponent {

    @Override
    public String componentId() {
        return "indexer";
    }

    @Override
    public boolean initRequired() {
        return true;
    }

    @Override
    public Optional<Duration> stopTimeout() {
        return Optional.of(Duration.ofSeconds(1));
    }

    @Override
    protected void doStart() {
        log.info("Indexer ready");
    }
}
