package com.inboundlogger.test.domain;

import com.inboundlogger.domain.config.model.valobj.ConfigurationOverrides;
import com.inboundlogger.domain.config.service.ConfigurationScope;
import com.inboundlogger.types.exception.ConfigurationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

public class ConfigurationScopeTest {

    private ConfigurationScope scope;

    @BeforeEach
    public void setUp() {
        scope = new ConfigurationScope();
    }

    @Test
    public void shouldApplyOverridesOnlyInsideBlock() {
        boolean inside = scope.withConfiguration(ConfigurationOverrides.enabled(true), () -> scope.current().isEnabled());

        Assertions.assertTrue(inside);
        Assertions.assertFalse(scope.current().isEnabled());
        Assertions.assertFalse(scope.hasOverride());
    }

    @Test
    public void shouldNotMutateGlobalConfiguration() {
        ConfigurationOverrides overrides = ConfigurationOverrides.builder()
                .maxBodySize(12)
                .excludedPath("^/scoped")
                .sensitiveBodyKey("iban")
                .build();

        scope.runWithConfiguration(overrides, () -> {
            Assertions.assertEquals(12, scope.current().getMaxBodySize());
            Assertions.assertFalse(scope.current().shouldLogPath("/scoped/data"));
            Assertions.assertEquals(10_000, scope.global().getMaxBodySize());
        });

        Assertions.assertEquals(10_000, scope.current().getMaxBodySize());
        Assertions.assertTrue(scope.current().shouldLogPath("/scoped/data"));
        Assertions.assertFalse(scope.current().getSensitiveBodyKeys().contains("iban"));
    }

    @Test
    public void shouldExcludeActionsOnlyInsideBlock() {
        ConfigurationOverrides overrides = ConfigurationOverrides.builder()
                .excludedAction("users", List.of("export", "import"))
                .build();

        scope.runWithConfiguration(overrides, () -> {
            Assertions.assertFalse(scope.current().enabledForController("users", "export"));
            Assertions.assertFalse(scope.current().enabledForController("users", "import"));
            Assertions.assertTrue(scope.current().enabledForController("users", "index"));
            Assertions.assertTrue(scope.global().enabledForController("users", "export"));
        });

        Assertions.assertTrue(scope.current().enabledForController("users", "export"));
    }

    @Test
    public void shouldRestoreEnclosingOverrideWhenNested() {
        scope.runWithConfiguration(ConfigurationOverrides.builder().enabled(true).maxBodySize(100).build(), () -> {
            scope.runWithConfiguration(ConfigurationOverrides.builder().maxBodySize(5).build(), () -> {
                Assertions.assertTrue(scope.current().isEnabled());
                Assertions.assertEquals(5, scope.current().getMaxBodySize());
            });
            Assertions.assertTrue(scope.hasOverride());
            Assertions.assertEquals(100, scope.current().getMaxBodySize());
        });
        Assertions.assertFalse(scope.hasOverride());
    }

    @Test
    public void shouldRestoreAfterException() {
        Assertions.assertThrows(IllegalStateException.class, () ->
                scope.runWithConfiguration(ConfigurationOverrides.enabled(true), () -> {
                    throw new IllegalStateException("boom");
                }));

        Assertions.assertFalse(scope.hasOverride());
        Assertions.assertFalse(scope.current().isEnabled());
    }

    @Test
    public void shouldRestoreAfterInvalidOverride() {
        ConfigurationOverrides invalid = ConfigurationOverrides.builder().excludedPath("(").build();

        Assertions.assertThrows(ConfigurationException.class, () -> scope.runWithConfiguration(invalid, () -> {
        }));
        Assertions.assertFalse(scope.hasOverride());
    }

    @Test
    public void shouldClearDefaultsWhenRequested() {
        ConfigurationOverrides overrides = ConfigurationOverrides.builder()
                .resetExcludedPaths(true)
                .excludedPath("^/only-this")
                .build();

        scope.runWithConfiguration(overrides, () -> {
            Assertions.assertTrue(scope.current().shouldLogPath("/health"));
            Assertions.assertFalse(scope.current().shouldLogPath("/only-this"));
        });
    }

    @Test
    public void shouldModifyScopedConfigurationThroughConfigure() {
        scope.runWithConfiguration(ConfigurationOverrides.none(), () -> {
            scope.configure(configuration -> configuration.setEnabled(true));
            Assertions.assertTrue(scope.current().isEnabled());
        });

        Assertions.assertFalse(scope.global().isEnabled());
    }

    @Test
    public void shouldIsolateConcurrentOverrides() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch allInside = new CountDownLatch(threads);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                int maxBodySize = 1000 + i;
                boolean enabled = i % 2 == 0;
                results.add(executor.submit(() -> scope.withConfiguration(
                        ConfigurationOverrides.builder().enabled(enabled).maxBodySize(maxBodySize).build(),
                        () -> {
                            allInside.countDown();
                            try {
                                allInside.await(5, TimeUnit.SECONDS);
                                Thread.sleep(20);
                            } catch (InterruptedException ex) {
                                Thread.currentThread().interrupt();
                                return false;
                            }
                            return scope.current().getMaxBodySize() == maxBodySize
                                    && scope.current().isEnabled() == enabled;
                        })));
            }
            for (Future<Boolean> result : results) {
                Assertions.assertTrue(result.get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
        Assertions.assertFalse(scope.current().isEnabled());
        Assertions.assertEquals(10_000, scope.current().getMaxBodySize());
    }
}
