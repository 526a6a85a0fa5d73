package com.chicu.anomalyguard.ml.storage;

import com.chicu.anomalyguard.ml.TestVectors;
import com.chicu.anomalyguard.ml.error.PersistenceDeleteException;
import com.chicu.anomalyguard.ml.error.PersistenceReadException;
import com.chicu.anomalyguard.ml.features.FeatureSchema;
import com.chicu.anomalyguard.ml.model.IsolationForestScorer;
import com.chicu.anomalyguard.ml.model.ModelBundle;
import com.chicu.anomalyguard.ml.model.StandardNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FileModelBundleStoreTest {

    private static final String SCHEMA = FeatureSchema.TELEMETRY.schemaHash();

    @TempDir
    Path dir;

    private FileModelBundleStore store;

    @BeforeEach
    void setUp() {
        store = new FileModelBundleStore(dir.resolve("models"), SCHEMA);
    }

    @Test
    void saveThenLoad_shouldPreserveScoringBehaviour() {
        List<double[]> window = TestVectors.normal(200, 11);
        ModelBundle bundle = fittedBundle(window, SCHEMA);

        store.save("sensor-1", bundle);
        ModelBundle loaded = store.load("sensor-1").orElseThrow();

        List<double[]> sample = TestVectors.normal(20, 12);
        sample.add(new double[]{90, 3, 1, 20});

        List<double[]> zBefore = bundle.normalizer().transform(sample);
        List<double[]> zAfter = loaded.normalizer().transform(sample);
        assertArrayEquals(bundle.scorer().score(zBefore), loaded.scorer().score(zAfter), 1e-12);
        assertEquals(bundle.scorer().classify(zBefore), loaded.scorer().classify(zAfter));
        assertEquals(bundle.trainedAt(), loaded.trainedAt());
        assertEquals(200, loaded.trainingSize());
    }

    @Test
    void save_shouldOverwritePreviousBundle() {
        store.save("d1", fittedBundle(TestVectors.normal(50, 1), SCHEMA));
        store.save("d1", fittedBundle(TestVectors.normal(80, 2), SCHEMA));

        assertEquals(80, store.load("d1").orElseThrow().trainingSize());
        assertEquals(Set.of("d1"), store.listDeviceIds());
    }

    @Test
    void load_missing_shouldBeEmpty() {
        assertTrue(store.load("nobody").isEmpty());
        assertFalse(store.exists("nobody"));
    }

    @Test
    void longMultibyteDeviceId_shouldSaveLoadListAndDelete() {
        String id = "传感器".repeat(42) + "-7";
        assertEquals(128, id.length());
        assertTrue(id.getBytes(StandardCharsets.UTF_8).length > 255);

        store.save(id, fittedBundle(TestVectors.normal(40, 21), SCHEMA));

        assertTrue(store.exists(id));
        assertEquals(40, store.load(id).orElseThrow().trainingSize());
        assertEquals(Set.of(id), store.listDeviceIds());
        assertTrue(store.delete(id));
        assertFalse(store.exists(id));
        assertFalse(store.delete(id));
    }

    @Test
    void fileOf_shouldHaveFixedLengthName() {
        String shortName = store.fileOf("d").getFileName().toString();
        String longName = store.fileOf("датчик".repeat(20)).getFileName().toString();

        assertEquals(64 + FileModelBundleStore.SUFFIX.length(), shortName.length());
        assertEquals(shortName.length(), longName.length());
        assertNotEquals(shortName, longName);
    }

    @Test
    void listDeviceIds_shouldReadIdsFromBundleFiles() {
        store.save("plant/line 3:pump#7", fittedBundle(TestVectors.normal(30, 3), SCHEMA));
        store.save("d2", fittedBundle(TestVectors.normal(30, 4), SCHEMA));

        assertEquals(Set.of("plant/line 3:pump#7", "d2"), store.listDeviceIds());
        assertTrue(store.exists("plant/line 3:pump#7"));
    }

    @Test
    void listDeviceIds_withoutDirectory_shouldBeEmpty() {
        assertTrue(store.listDeviceIds().isEmpty());
    }

    @Test
    void delete_shouldReportWhetherBundleExisted() {
        store.save("d1", fittedBundle(TestVectors.normal(30, 5), SCHEMA));

        assertTrue(store.delete("d1"));
        assertFalse(store.exists("d1"));
        assertFalse(store.delete("d1"));
    }

    @Test
    void load_corruptFile_shouldThrowReadError() throws Exception {
        Files.createDirectories(store.directory());
        Files.write(store.fileOf("broken"), new byte[]{1, 2, 3, 4, 5});

        assertThrows(PersistenceReadException.class, () -> store.load("broken"));
    }

    @Test
    void load_classOutsideAllowList_shouldBeRejected() throws Exception {
        writeRaw("intruder", "intruder", new Intruder("payload"));

        PersistenceReadException ex = assertThrows(PersistenceReadException.class, () -> store.load("intruder"));
        assertEquals("intruder", ex.getDeviceId());
    }

    @Test
    void load_fileOfAnotherDevice_shouldThrowReadError() throws Exception {
        writeRaw("d1", "d2", fittedBundle(TestVectors.normal(30, 7), SCHEMA));

        assertThrows(PersistenceReadException.class, () -> store.load("d1"));
    }

    @Test
    void listDeviceIds_shouldSkipUnreadableFiles() throws Exception {
        store.save("d1", fittedBundle(TestVectors.normal(30, 8), SCHEMA));
        Files.write(store.directory().resolve("junk" + FileModelBundleStore.SUFFIX), new byte[]{9, 9, 9});

        assertEquals(Set.of("d1"), store.listDeviceIds());
    }

    @Test
    void load_foreignSchema_shouldThrowReadError() {
        store.save("d1", fittedBundle(TestVectors.normal(30, 6), "other-schema"));

        assertThrows(PersistenceReadException.class, () -> store.load("d1"));
    }

    @Test
    void delete_whenFileCannotBeRemoved_shouldThrowDeleteError() throws Exception {
        Path blocker = store.fileOf("stuck");
        Files.createDirectories(blocker);
        Files.writeString(blocker.resolve("keep"), "x");

        assertThrows(PersistenceDeleteException.class, () -> store.delete("stuck"));
    }

    private void writeRaw(String fileFor, String headerId, Object payload) throws Exception {
        Files.createDirectories(store.directory());
        try (OutputStream os = Files.newOutputStream(store.fileOf(fileFor));
             ObjectOutputStream oos = new ObjectOutputStream(os)) {
            oos.writeUTF(headerId);
            oos.writeObject(payload);
        }
    }

    record Intruder(String payload) implements Serializable {
    }

    private static ModelBundle fittedBundle(List<double[]> window, String schemaHash) {
        StandardNormalizer normalizer = new StandardNormalizer();
        normalizer.fit(window);
        IsolationForestScorer scorer = new IsolationForestScorer(25, 0.7, 0.03);
        scorer.fit(normalizer.transform(window));
        return new ModelBundle(scorer, normalizer, schemaHash, Instant.parse("2024-05-01T10:00:00Z"), window.size());
    }
}
