package com.chicu.anomalyguard.ml.storage;

import com.chicu.anomalyguard.ml.error.PersistenceDeleteException;
import com.chicu.anomalyguard.ml.error.PersistenceReadException;
import com.chicu.anomalyguard.ml.error.PersistenceWriteException;
import com.chicu.anomalyguard.ml.features.FeatureSchema;
import com.chicu.anomalyguard.ml.model.ModelBundle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputFilter;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Один файл на устройство: {modelsDir}/{sha256(deviceId)}.model.
 * Внутри: deviceId (writeUTF), затем java-сериализованный {@link ModelBundle}.
 * Имя файла фиксированной длины при любом deviceId, сам id читается из заголовка.
 * Запись через tmp-файл + atomic move, чтобы читатель не увидел половину бандла.
 * <p>
 * Десериализация ограничена {@link #BUNDLE_FILTER}: только классы модели, Smile и JDK-типы полей.
 */
@Slf4j
@Component
public class FileModelBundleStore implements ModelBundleStore {

    static final String SUFFIX = ".model";

    static final ObjectInputFilter BUNDLE_FILTER = ObjectInputFilter.Config.createFilter(
            "maxdepth=256;"
                    + "com.chicu.anomalyguard.ml.model.*;"
                    + "smile.anomaly.*;"
                    + "java.time.*;"
                    + "java.lang.String;"
                    + "!*");

    private final Path dir;
    private final String expectedSchemaHash;

    @Autowired
    public FileModelBundleStore(MlStorageProperties props) {
        this(Paths.get(props.getModelsDir()), FeatureSchema.TELEMETRY.schemaHash());
    }

    public FileModelBundleStore(Path dir, String expectedSchemaHash) {
        this.dir = dir;
        this.expectedSchemaHash = expectedSchemaHash;
    }

    public Path directory() {
        return dir;
    }

    @Override
    public void save(String deviceId, ModelBundle bundle) {
        Path target = fileOf(deviceId);
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, "bundle-", ".tmp");
            try (OutputStream os = Files.newOutputStream(tmp);
                 ObjectOutputStream oos = new ObjectOutputStream(os)) {
                oos.writeUTF(deviceId);
                oos.writeObject(bundle);
            }
            move(tmp, target);
            log.debug("💾 bundle saved deviceId={} path={}", deviceId, target);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new PersistenceWriteException(deviceId, "failed to write model bundle: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<ModelBundle> load(String deviceId) {
        Path file = fileOf(deviceId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try (InputStream is = Files.newInputStream(file);
             ObjectInputStream ois = new ObjectInputStream(is)) {
            ois.setObjectInputFilter(BUNDLE_FILTER);
            String storedId = ois.readUTF();
            if (!deviceId.equals(storedId)) {
                throw new PersistenceReadException(deviceId, "bundle file belongs to another device: " + storedId, null);
            }
            Object obj = ois.readObject();
            if (!(obj instanceof ModelBundle bundle)) {
                throw new PersistenceReadException(deviceId,
                        "unexpected object in bundle file: " + (obj == null ? "null" : obj.getClass().getName()), null);
            }
            if (expectedSchemaHash != null && !expectedSchemaHash.equals(bundle.schemaHash())) {
                throw new PersistenceReadException(deviceId,
                        "bundle feature schema mismatch: " + bundle.schemaHash(), null);
            }
            return Optional.of(bundle);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException | ClassNotFoundException | ClassCastException e) {
            throw new PersistenceReadException(deviceId, "failed to read model bundle: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean delete(String deviceId) {
        try {
            return Files.deleteIfExists(fileOf(deviceId));
        } catch (IOException e) {
            throw new PersistenceDeleteException(deviceId, "failed to delete model bundle: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean exists(String deviceId) {
        return Files.isRegularFile(fileOf(deviceId));
    }

    @Override
    public Set<String> listDeviceIds() {
        Set<String> ids = new TreeSet<>();
        if (!Files.isDirectory(dir)) {
            return ids;
        }
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path p : ds) {
                try (InputStream is = Files.newInputStream(p);
                     ObjectInputStream ois = new ObjectInputStream(is)) {
                    ids.add(ois.readUTF());
                } catch (IOException e) {
                    log.warn("⚠️ skip unreadable file in models dir: {} ({})", p.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new PersistenceReadException(null, "failed to list models dir " + dir + ": " + e.getMessage(), e);
        }
        return ids;
    }

    Path fileOf(String deviceId) {
        return dir.resolve(fileKey(deviceId) + SUFFIX);
    }

    static String fileKey(String deviceId) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(deviceId.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static void move(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path p) {
        if (p == null) return;
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.warn("⚠️ failed to remove tmp bundle {}: {}", p, e.getMessage());
        }
    }
}
