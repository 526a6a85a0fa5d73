package com.chicu.anomalyguard.ml.registry;

import com.chicu.anomalyguard.ml.TestVectors;
import com.chicu.anomalyguard.ml.error.PersistenceDeleteException;
import com.chicu.anomalyguard.ml.error.PersistenceReadException;
import com.chicu.anomalyguard.ml.error.PersistenceWriteException;
import com.chicu.anomalyguard.ml.model.ModelBundle;
import com.chicu.anomalyguard.ml.model.StandardNormalizer;
import com.chicu.anomalyguard.ml.model.StubScorer;
import com.chicu.anomalyguard.ml.storage.ModelBundleStore;
import com.chicu.anomalyguard.ml.window.SlidingWindowStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ModelRegistryTest {

    @Mock
    private ModelBundleStore store;

    private SlidingWindowStore windows;
    private ModelRegistry registry;

    @BeforeEach
    void setUp() {
        windows = new SlidingWindowStore(512);
        registry = new ModelRegistry(store, windows);
    }

    @Test
    void getOrCreate_unknownDevice_shouldCreateFreshUntrainedState() {
        when(store.load("d1")).thenReturn(Optional.empty());

        ModelState st = registry.getOrCreate("d1");

        assertFalse(st.isTrained());
        assertEquals(0, st.getPointsSinceTrain());
        assertSame(st, registry.getOrCreate("d1"), "second call must hit the cache");
        verify(store, times(1)).load("d1");
        assertEquals(1, registry.activeCount());
    }

    @Test
    void getOrCreate_persistedDevice_shouldRestoreTrainedStateWithZeroCounter() {
        StubScorer scorer = new StubScorer();
        StandardNormalizer normalizer = new StandardNormalizer();
        normalizer.fit(TestVectors.normal(20, 1));
        Instant at = Instant.parse("2024-03-01T00:00:00Z");
        when(store.load("d1")).thenReturn(Optional.of(new ModelBundle(scorer, normalizer, "h", at, 20)));

        ModelState st = registry.getOrCreate("d1");

        assertTrue(st.isTrained());
        assertEquals(0, st.getPointsSinceTrain());
        assertSame(scorer, st.getScorer());
        assertSame(normalizer, st.getNormalizer());
        assertEquals(at, st.getTrainedAt());
    }

    @Test
    void getOrCreate_unreadableBundle_shouldFallBackToFreshState() {
        when(store.load("d1")).thenThrow(new PersistenceReadException("d1", "corrupt", null));

        ModelState st = assertDoesNotThrow(() -> registry.getOrCreate("d1"));

        assertFalse(st.isTrained());
    }

    @Test
    void save_writeFailure_shouldBeNonFatal() {
        ModelState st = trainedState("d1");
        doThrow(new PersistenceWriteException("d1", "disk full", null)).when(store).save(eq("d1"), any());

        assertFalse(registry.save("d1", st));
        assertTrue(st.isTrained(), "fit stays usable in memory");
    }

    @Test
    void save_shouldWriteBundleOfCurrentFit() {
        ModelState st = trainedState("d1");

        assertTrue(registry.save("d1", st));

        verify(store).save(eq("d1"), argThat(b -> b.scorer() == st.getScorer()
                && b.normalizer() == st.getNormalizer()
                && b.trainingSize() == 30));
    }

    @Test
    void purge_shouldRemoveMemoryWindowAndBundle() {
        when(store.load("d1")).thenReturn(Optional.empty());
        when(store.delete("d1")).thenReturn(true);
        registry.getOrCreate("d1");
        windows.append("d1", TestVectors.normal(5, 2));

        ModelRegistry.PurgeResult res = registry.purge("d1");

        assertTrue(res.inMemoryRemoved());
        assertTrue(res.persistedRemoved());
        assertTrue(registry.find("d1").isEmpty());
        assertEquals(0, windows.size("d1"));
    }

    @Test
    void purge_unknownDevice_shouldSucceed() {
        when(store.delete("ghost")).thenReturn(false);

        ModelRegistry.PurgeResult res = registry.purge("ghost");

        assertFalse(res.inMemoryRemoved());
        assertFalse(res.persistedRemoved());
    }

    @Test
    void purge_deleteFailure_shouldSurfaceAndKeepMemoryIntact() {
        when(store.load("d1")).thenReturn(Optional.empty());
        when(store.delete("d1")).thenThrow(new PersistenceDeleteException("d1", "read-only fs", null));
        ModelState st = registry.getOrCreate("d1");
        windows.append("d1", TestVectors.normal(5, 3));

        assertThrows(PersistenceDeleteException.class, () -> registry.purge("d1"));

        assertSame(st, registry.find("d1").orElseThrow());
        assertEquals(5, windows.size("d1"));
    }

    private ModelState trainedState(String deviceId) {
        ModelState st = ModelState.fresh(deviceId);
        StandardNormalizer normalizer = new StandardNormalizer();
        normalizer.fit(TestVectors.normal(30, 9));
        st.commitFit(new StubScorer(), normalizer, Instant.now(), 30);
        return st;
    }
}
