package com.delver.navigation;

import com.delver.config.PathfindingConfig;
import com.delver.config.PathfindingConfigLoader;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/**
 * Guice module for the pathfinding components.
 *
 * <p>The cost model, stuck detector, smoother and path finder are {@code @Singleton}
 * on the classes themselves. This module supplies the configuration, either the one
 * given to it or the bundled {@code pathfinding.json}.
 */
@Slf4j
public class NavigationModule extends AbstractModule {

    private final PathfindingConfig config;

    /**
     * Use the bundled configuration resource.
     */
    public NavigationModule() {
        this(null);
    }

    public NavigationModule(PathfindingConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        // Component bindings come from @Singleton / @Inject on the classes
    }

    @Provides
    @Singleton
    public PathfindingConfig providePathfindingConfig() {
        if (config != null) {
            return config;
        }
        PathfindingConfig loaded = PathfindingConfigLoader.loadDefault();
        log.debug("Pathfinding config: tile size {}, {} expansions", loaded.getTileSize(), loaded.getMaxExpansions());
        return loaded;
    }
}
