package com.chicu.anomalyguard.ml.features;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.List;

/**
 * Фиксированный порядок каналов. Должен совпадать между обучением и скорингом,
 * поэтому хэш схемы пишется в каждый сохранённый бандл.
 */
public class FeatureSchema {

    public static final FeatureSchema TELEMETRY = new FeatureSchema(List.of(
            "temperature_c",
            "vibration_g",
            "humidity_pct",
            "voltage_v"
    ));

    private final String[] names;
    private final String schemaHash;

    public FeatureSchema(String[] names) {
        if (names == null || names.length == 0) {
            throw new IllegalArgumentException("schema names are empty");
        }
        this.names = names.clone();
        this.schemaHash = sha256(String.join("|", this.names));
    }

    public FeatureSchema(List<String> names) {
        this(names != null ? names.toArray(new String[0]) : null);
    }

    public String[] featureNames() {
        return names.clone();
    }

    public String schemaHash() {
        return schemaHash;
    }

    private static String sha256(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(s.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(dig);
        } catch (Exception e) {
            throw new IllegalStateException("sha256 error: " + e.getMessage(), e);
        }
    }
}
