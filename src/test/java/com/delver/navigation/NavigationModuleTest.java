package com.delver.navigation;

import com.delver.config.PathfindingConfig;
import com.google.inject.Guice;
import com.google.inject.Injector;
import org.junit.Test;

import static org.junit.Assert.*;

public class NavigationModuleTest {

    @Test
    public void testBundledConfig_MatchesDefaults() {
        Injector injector = Guice.createInjector(new NavigationModule());

        assertEquals(PathfindingConfig.DEFAULT, injector.getInstance(PathfindingConfig.class));
    }

    @Test
    public void testProvidedConfig_ReachesPathFinder() {
        PathfindingConfig config = PathfindingConfig.DEFAULT.withTileSize(16);
        Injector injector = Guice.createInjector(new NavigationModule(config));

        PathFinder pathFinder = injector.getInstance(PathFinder.class);

        assertSame(config, pathFinder.getConfig());
    }

    @Test
    public void testPathFinder_IsSingleton() {
        Injector injector = Guice.createInjector(new NavigationModule(PathfindingConfig.DEFAULT));

        assertSame(injector.getInstance(PathFinder.class), injector.getInstance(PathFinder.class));
        assertSame(injector.getInstance(StuckDetector.class), injector.getInstance(StuckDetector.class));
    }

    @Test
    public void testPursuitNavigator_OnePerAgent() {
        Injector injector = Guice.createInjector(new NavigationModule(PathfindingConfig.DEFAULT));

        PursuitNavigator first = injector.getInstance(PursuitNavigator.class);
        PursuitNavigator second = injector.getInstance(PursuitNavigator.class);

        assertNotSame(first, second);
        assertFalse(first.hasPlan());
    }

    @Test
    public void testInjectedPathFinder_FindsPath() {
        Injector injector = Guice.createInjector(new NavigationModule(PathfindingConfig.DEFAULT));
        PathFinder pathFinder = injector.getInstance(PathFinder.class);
        GridTileMap map = new GridTileMap(8, 8);

        assertTrue(pathFinder.hasPath(map,
                Waypoint.tileCenter(2, 2, PathfindingConfig.TILE_SIZE),
                Waypoint.tileCenter(5, 5, PathfindingConfig.TILE_SIZE)));
    }
}
