package com.clarity.serving.service.lifecycle;

import com.clarity.serving.config.ServingProperties;
import com.clarity.serving.exception.FallbackExhaustedException;
import com.clarity.serving.exception.ModelUnloadedException;
import com.clarity.serving.exception.ModelLoadException;
import com.clarity.serving.model.LoadingStrategy;
import com.clarity.serving.model.ModelFormat;
import com.clarity.serving.model.ModelState;
import com.clarity.serving.model.dto.ModelStatus;
import com.clarity.serving.monitor.ServingMetrics;
import com.clarity.serving.service.batch.ServingModel;
import com.clarity.serving.service.inference.CompilableModel;
import com.clarity.serving.service.inference.InferenceModel;
import com.clarity.serving.service.optimization.ModelOptimizer;
import com.clarity.serving.service.window.WindowNormalizer;
import com.clarity.serving.support.FakeInferenceModel;
import com.clarity.serving.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class ModelVersionManagerTest {

    private ServingProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private ExecutorService loadingExecutor;
    private ScriptedLoader onnxLoader;
    private ScriptedLoader baselineLoader;
    private MutableClock clock;
    private ModelVersionManager manager;

    @BeforeEach
    void setUp() {
        properties = new ServingProperties();
        properties.getModels().setLoadingStrategy(LoadingStrategy.LAZY);
        properties.getModels().setLoadTimeout(Duration.ofSeconds(5));
        properties.getModels().setPrimaryId("pat");
        properties.getModels().setPrimaryVersion("1.0.0");
        properties.getModels().setFallbackId("baseline");
        properties.getOptimization().setEnabled(false);

        meterRegistry = new SimpleMeterRegistry();
        clock = new MutableClock(Instant.parse("2024-03-01T00:00:00Z"));
        loadingExecutor = Executors.newFixedThreadPool(2);
        onnxLoader = new ScriptedLoader(ModelFormat.ONNX);
        baselineLoader = new ScriptedLoader(ModelFormat.BASELINE);
        manager = newManager();
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
        loadingExecutor.shutdownNow();
    }

    @Test
    @DisplayName("Concurrent callers share a single load and then get the cached handle")
    void testConcurrentLoadHappensOnce() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        onnxLoader.behavior = version -> {
            entered.countDown();
            await(release);
            return new FakeInferenceModel(version.getModelId(), version.getVersion());
        };
        manager.register("pat", "1.0.0", ModelFormat.ONNX, "pat.onnx", true);

        ExecutorService callers = Executors.newFixedThreadPool(8);
        try {
            List<Future<Optional<InferenceModel>>> results = new ArrayList<>();
            results.add(callers.submit(() -> manager.getModel("pat", "1.0.0", true)));
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            assertEquals(ModelState.LOADING, state("pat", "1.0.0"));

            for (int i = 0; i < 7; i++) {
                results.add(callers.submit(() -> manager.getModel("pat", "1.0.0", true)));
            }
            release.countDown();

            InferenceModel first = results.get(0).get(5, TimeUnit.SECONDS).orElseThrow();
            for (Future<Optional<InferenceModel>> result : results) {
                assertSame(first, result.get(5, TimeUnit.SECONDS).orElseThrow());
            }
        } finally {
            callers.shutdownNow();
        }

        assertEquals(1, onnxLoader.loads.get());
        assertEquals(ModelState.AVAILABLE, state("pat", "1.0.0"));

        manager.getModel("pat", "1.0.0", true);
        assertEquals(1, onnxLoader.loads.get(), "available model is not reloaded");
    }

    @Test
    @DisplayName("Non-critical load failure yields empty and records the error")
    void testNonCriticalFailure() {
        onnxLoader.behavior = version -> {
            throw new IllegalStateException("weights unreadable");
        };
        manager.register("pat", "1.0.0", ModelFormat.ONNX, "pat.onnx", false);

        Optional<InferenceModel> model = assertDoesNotThrow(() -> manager.getModel("pat", "1.0.0", false));

        assertTrue(model.isEmpty());
        ModelStatus status = status("pat", "1.0.0");
        assertEquals(ModelState.ERROR, status.getState());
        assertTrue(status.getErrorMessage().contains("weights unreadable"));
        assertEquals(1.0, meterRegistry.counter("clarity.model.loads",
                "model", "pat", "version", "1.0.0", "outcome", "failure").count());
    }

    @Test
    @DisplayName("Critical load failure is surfaced to the caller")
    void testCriticalFailure() {
        onnxLoader.behavior = version -> {
            throw new ModelLoadException(version.getModelId(), version.getVersion(), "corrupt graph");
        };
        manager.register("pat", "1.0.0", ModelFormat.ONNX, "pat.onnx", true);

        ModelLoadException e = assertThrows(ModelLoadException.class, () -> manager.getModel("pat", "1.0.0", true));

        assertEquals("corrupt graph", e.getMessage());
        assertFalse(manager.isReady());
    }

    @Test
    @DisplayName("A failed version fails fast during the retry backoff and is retried after it")
    void testRetryAfterError() {
        AtomicInteger attempts = new AtomicInteger();
        onnxLoader.behavior = version -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("transient");
            }
            return new FakeInferenceModel(version.getModelId(), version.getVersion());
        };
        manager.register("pat", "1.0.0", ModelFormat.ONNX, "pat.onnx", false);

        assertTrue(manager.getModel("pat", "1.0.0", false).isEmpty());
        assertTrue(manager.getModel("pat", "1.0.0", false).isEmpty());
        assertThrows(ModelLoadException.class, () -> manager.getModel("pat", "1.0.0", true));
        assertEquals(1, onnxLoader.loads.get(), "no load attempt within the backoff");

        clock.advance(properties.getModels().getRetryBackoff());

        assertTrue(manager.getModel("pat", "1.0.0", false).isPresent());
        assertEquals(2, onnxLoader.loads.get());
        assertEquals(ModelState.AVAILABLE, state("pat", "1.0.0"));
        assertNull(status("pat", "1.0.0").getErrorMessage());
    }

    @Test
    @DisplayName("Unregistered models are empty when optional and fail when critical")
    void testUnregistered() {
        assertTrue(manager.getModel("ghost", "1.0.0", false).isEmpty());
        assertThrows(ModelLoadException.class, () -> manager.getModel("ghost", "1.0.0", true));
    }

    @Test
    @DisplayName("'latest' resolves to the highest version numerically")
    void testLatestAlias() {
        manager.register("pat", "1.2.0", ModelFormat.ONNX, "a.onnx", false);
        manager.register("pat", "1.10.0", ModelFormat.ONNX, "b.onnx", false);
        manager.register("pat", "1.9.3", ModelFormat.ONNX, "c.onnx", false);

        InferenceModel model = manager.getModel("pat", ModelVersionManager.LATEST, true).orElseThrow();

        assertEquals("1.10.0", model.version());
        assertTrue(ModelVersionManager.compareVersions("1.10.0", "1.9.3") > 0);
        assertEquals(0, ModelVersionManager.compareVersions("2.0", "2.0.0"));
        assertThrows(IllegalArgumentException.class,
                () -> manager.register("pat", ModelVersionManager.LATEST, ModelFormat.ONNX, "d.onnx", false));
    }

    @Test
    @DisplayName("Unload releases the handle and rejects later predictions on it")
    void testUnload() {
        manager.register("pat", "1.0.0", ModelFormat.ONNX, "pat.onnx", false);
        InferenceModel handle = manager.getModel("pat", "1.0.0", true).orElseThrow();

        assertTrue(manager.unload("pat", "1.0.0"));

        assertEquals(ModelState.NOT_LOADED, state("pat", "1.0.0"));
        assertTrue(onnxLoader.created.get(0).isClosed());
        assertThrows(ModelUnloadedException.class, () -> handle.predict(new float[]{0.5f}));
        assertFalse(manager.unload("pat", "1.0.0"));
    }

    @Test
    @DisplayName("Reload unloads the active version and activates the requested one")
    void testReloadToNewVersion() {
        manager.register("pat", "1.0.0", ModelFormat.ONNX, "small.onnx", true);
        manager.register("pat", "1.1.0", ModelFormat.ONNX, "medium.onnx", true);
        manager.reload("pat", "1.0.0");

        InferenceModel reloaded = manager.reload("pat", "1.1.0");

        assertEquals("1.1.0", reloaded.version());
        assertEquals(ModelState.NOT_LOADED, state("pat", "1.0.0"));
        assertEquals(ModelState.AVAILABLE, state("pat", "1.1.0"));
        assertTrue(onnxLoader.created.get(0).isClosed());
        assertEquals(Optional.of("1.1.0"), manager.activeVersionOf("pat"));
        assertTrue(status("pat", "1.1.0").isActive());
        assertEquals("1.1.0", manager.servingModel().getModel().version());
    }

    @Test
    @DisplayName("Serving during a reload waits for the new version and never revives the old one")
    void testServingDuringReload() throws Exception {
        CountDownLatch closing = new CountDownLatch(1);
        CountDownLatch releaseClose = new CountDownLatch(1);
        onnxLoader.behavior = version -> {
            if (!version.getVersion().equals("1.0.0")) {
                return new FakeInferenceModel(version.getModelId(), version.getVersion());
            }
            return new FakeInferenceModel("pat", "1.0.0") {
                @Override
                public void close() {
                    closing.countDown();
                    ModelVersionManagerTest.await(releaseClose);
                    super.close();
                }
            };
        };
        manager.register("pat", "1.0.0", ModelFormat.ONNX, "small.onnx", true);
        manager.register("pat", "1.1.0", ModelFormat.ONNX, "medium.onnx", true);
        manager.reload("pat", "1.0.0");
        InferenceModel previous = manager.servingModel().getModel();

        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            Future<InferenceModel> reload = callers.submit(() -> manager.reload("pat", "1.1.0"));
            assertTrue(closing.await(5, TimeUnit.SECONDS));

            Future<ServingModel> served = callers.submit(() -> manager.servingModel());
            Thread.sleep(100);
            assertFalse(served.isDone(), "waits while the old handle is released");
            releaseClose.countDown();

            assertEquals("1.1.0", served.get(5, TimeUnit.SECONDS).getModel().version());
            assertEquals("1.1.0", reload.get(5, TimeUnit.SECONDS).version());
        } finally {
            releaseClose.countDown();
            callers.shutdownNow();
        }

        assertEquals(2, onnxLoader.loads.get());
        assertEquals(ModelState.NOT_LOADED, state("pat", "1.0.0"));
        assertTrue(onnxLoader.created.get(0).isClosed());
        assertThrows(ModelUnloadedException.class, () -> previous.predict(new float[]{0.5f}));
    }

    @Test
    @DisplayName("A loader that throws an Error ends in ERROR and releases waiters")
    void testLoaderError() {
        onnxLoader.behavior = version -> {
            throw new NoClassDefFoundError("ai/onnxruntime/OrtEnvironment");
        };
        properties.getModels().setLoadTimeout(Duration.ofSeconds(30));
        manager.register("pat", "1.0.0", ModelFormat.ONNX, "pat.onnx", false);

        long startTime = System.nanoTime();
        Optional<InferenceModel> model = manager.getModel("pat", "1.0.0", false);

        assertTrue(model.isEmpty());
        assertTrue(System.nanoTime() - startTime < TimeUnit.SECONDS.toNanos(10), "does not wait for the timeout");
        ModelStatus status = status("pat", "1.0.0");
        assertEquals(ModelState.ERROR, status.getState());
        assertTrue(status.getErrorMessage().contains("NoClassDefFoundError"));

        clock.advance(properties.getModels().getRetryBackoff());
        assertThrows(ModelLoadException.class, () -> manager.getModel("pat", "1.0.0", true));
        assertEquals(2, onnxLoader.loads.get());
    }

    @Test
    @DisplayName("Reloading the same version replaces its handle")
    void testReloadSameVersion() {
        manager.register("pat", "1.0.0", ModelFormat.ONNX, "pat.onnx", true);
        InferenceModel before = manager.getModel("pat", "1.0.0", true).orElseThrow();

        InferenceModel after = manager.reload("pat", "1.0.0");

        assertNotSame(before, after);
        assertEquals(2, onnxLoader.loads.get());
        assertTrue(onnxLoader.created.get(0).isClosed());
        assertFalse(onnxLoader.created.get(1).isClosed());
    }

    @Test
    @DisplayName("Failed swap leaves the previous version serving")
    void testSwapFailureKeepsPrevious() {
        onnxLoader.behavior = version -> {
            if (version.getVersion().equals("1.2.0")) {
                throw new IllegalStateException("bad artifact");
            }
            return new FakeInferenceModel(version.getModelId(), version.getVersion());
        };
        manager.register("pat", "1.0.0", ModelFormat.ONNX, "small.onnx", true);
        manager.register("pat", "1.2.0", ModelFormat.ONNX, "large.onnx", true);
        manager.swap("pat", "1.0.0");

        assertThrows(ModelLoadException.class, () -> manager.swap("pat", "1.2.0"));

        assertEquals(Optional.of("1.0.0"), manager.activeVersionOf("pat"));
        assertEquals(ModelState.AVAILABLE, state("pat", "1.0.0"));
    }

    @Test
    @DisplayName("Swap loads the new version before unloading the old one")
    void testSwap() {
        manager.register("pat", "1.0.0", ModelFormat.ONNX, "small.onnx", true);
        manager.register("pat", "1.1.0", ModelFormat.ONNX, "medium.onnx", true);
        manager.swap("pat", "1.0.0");

        InferenceModel swapped = manager.swap("pat", "1.1.0");

        assertEquals("1.1.0", swapped.version());
        assertEquals(ModelState.NOT_LOADED, state("pat", "1.0.0"));
        assertEquals(Optional.of("1.1.0"), manager.activeVersionOf("pat"));
    }

    @Test
    @DisplayName("Primary model serves when available")
    void testServingPrimary() {
        manager.register("pat", "1.0.0", ModelFormat.ONNX, "pat.onnx", false);
        manager.register("baseline", "1.0.0", ModelFormat.BASELINE, null, false);

        ServingModel serving = manager.servingModel();

        assertEquals("pat", serving.getModel().modelId());
        assertFalse(serving.isFallback());
        assertEquals(0, baselineLoader.loads.get());
    }

    @Test
    @DisplayName("Baseline serves, flagged as fallback, when the primary cannot load")
    void testServingFallback() {
        onnxLoader.behavior = version -> {
            throw new IllegalStateException("no runtime");
        };
        manager.register("pat", "1.0.0", ModelFormat.ONNX, "pat.onnx", false);
        manager.register("baseline", "1.0.0", ModelFormat.BASELINE, null, false);

        ServingModel serving = manager.servingModel();

        assertEquals("baseline", serving.getModel().modelId());
        assertTrue(serving.isFallback());
    }

    @Test
    @DisplayName("No primary and no baseline is fatal")
    void testFallbackExhausted() {
        onnxLoader.behavior = version -> {
            throw new IllegalStateException("no runtime");
        };
        baselineLoader.behavior = onnxLoader.behavior;
        manager.register("pat", "1.0.0", ModelFormat.ONNX, "pat.onnx", false);
        manager.register("baseline", "1.0.0", ModelFormat.BASELINE, null, false);

        assertThrows(FallbackExhaustedException.class, () -> manager.servingModel());

        properties.getModels().setFallbackId("");
        assertThrows(FallbackExhaustedException.class, () -> manager.servingModel());
    }

    @Test
    @DisplayName("Waiting longer than the load timeout counts as a failure")
    void testLoadTimeout() {
        CountDownLatch release = new CountDownLatch(1);
        onnxLoader.behavior = version -> {
            await(release);
            return new FakeInferenceModel(version.getModelId(), version.getVersion());
        };
        properties.getModels().setLoadTimeout(Duration.ofMillis(100));
        manager.register("pat", "1.0.0", ModelFormat.ONNX, "pat.onnx", false);

        try {
            assertTrue(manager.getModel("pat", "1.0.0", false).isEmpty());
            assertThrows(ModelLoadException.class, () -> manager.getModel("pat", "1.0.0", true));
        } finally {
            release.countDown();
        }
    }

    @Test
    @DisplayName("Eager strategy loads everything at startup and fails on a critical error")
    void testEagerInitialization() {
        properties.getModels().setLoadingStrategy(LoadingStrategy.EAGER);
        properties.getModels().setRegistrations(List.of(
                registration("pat", "1.0.0", ModelFormat.ONNX, false),
                registration("baseline", "1.0.0", ModelFormat.BASELINE, true)));

        manager.initialize();

        assertTrue(manager.isReady());
        assertEquals(ModelState.AVAILABLE, state("pat", "1.0.0"));
        assertTrue(status("pat", "1.0.0").isActive());

        ModelVersionManager failing = newManager();
        baselineLoader.behavior = version -> {
            throw new IllegalStateException("broken");
        };
        assertThrows(ModelLoadException.class, failing::initialize);
    }

    @Test
    @DisplayName("Progressive strategy loads in the background without blocking startup")
    void testProgressiveInitialization() throws InterruptedException {
        properties.getModels().setLoadingStrategy(LoadingStrategy.PROGRESSIVE);
        properties.getModels().setRegistrations(List.of(
                registration("pat", "1.0.0", ModelFormat.ONNX, false),
                registration("baseline", "1.0.0", ModelFormat.BASELINE, true)));

        manager.initialize();

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while ((state("pat", "1.0.0") != ModelState.AVAILABLE || !manager.isReady())
                && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(manager.isReady());
        assertEquals(ModelState.AVAILABLE, state("pat", "1.0.0"));
        assertEquals(1, baselineLoader.loads.get());
        assertEquals(1, onnxLoader.loads.get());
    }

    @Test
    @DisplayName("Compiled handle replaces the raw one after load")
    void testOptimizationAfterLoad() {
        properties.getOptimization().setEnabled(true);
        properties.getOptimization().setWarmUpIterations(2);
        FakeInferenceModel compiled = new FakeInferenceModel("pat", "1.0.0") {
            @Override
            public boolean isOptimized() {
                return true;
            }
        };
        CompilableFake raw = new CompilableFake(compiled);
        onnxLoader.behavior = version -> raw;
        manager.register("pat", "1.0.0", ModelFormat.ONNX, "pat.onnx", false);

        InferenceModel model = manager.getModel("pat", "1.0.0", true).orElseThrow();

        assertTrue(model.isOptimized());
        assertTrue(raw.isClosed());
        assertEquals(2, compiled.predictions());
        assertTrue(status("pat", "1.0.0").isOptimized());
        assertNotNull(status("pat", "1.0.0").getLoadedAt());
    }

    private ModelVersionManager newManager() {
        return new ModelVersionManager(
                List.of(onnxLoader, baselineLoader),
                new ModelOptimizer((Path) null, new WindowNormalizer()),
                properties,
                new ServingMetrics(meterRegistry),
                clock,
                loadingExecutor);
    }

    private ModelState state(String modelId, String version) {
        return status(modelId, version).getState();
    }

    private ModelStatus status(String modelId, String version) {
        return manager.status().stream()
                .filter(s -> s.getModelId().equals(modelId) && s.getVersion().equals(version))
                .findFirst()
                .orElseThrow();
    }

    private static ServingProperties.ModelRegistration registration(String id, String version,
                                                                    ModelFormat format, boolean critical) {
        ServingProperties.ModelRegistration registration = new ServingProperties.ModelRegistration();
        registration.setId(id);
        registration.setVersion(version);
        registration.setFormat(format);
        registration.setCritical(critical);
        return registration;
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static class ScriptedLoader implements ModelLoader {
        private final ModelFormat format;
        private final AtomicInteger loads = new AtomicInteger();
        private final List<FakeInferenceModel> created = new CopyOnWriteArrayList<>();
        private volatile Function<ModelVersion, InferenceModel> behavior;

        ScriptedLoader(ModelFormat format) {
            this.format = format;
            this.behavior = version -> new FakeInferenceModel(version.getModelId(), version.getVersion());
        }

        @Override
        public ModelFormat format() {
            return format;
        }

        @Override
        public InferenceModel load(ModelVersion version) {
            loads.incrementAndGet();
            InferenceModel model = behavior.apply(version);
            if (model instanceof FakeInferenceModel fake) {
                created.add(fake);
            }
            return model;
        }
    }

    private static class CompilableFake extends FakeInferenceModel implements CompilableModel {
        private final InferenceModel compiled;

        CompilableFake(InferenceModel compiled) {
            super("pat", "1.0.0");
            this.compiled = compiled;
        }

        @Override
        public InferenceModel compile(Path outputDir) {
            return compiled;
        }
    }
}
