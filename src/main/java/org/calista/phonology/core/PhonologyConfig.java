package org.calista.phonology.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.phonology.feature.impl.TableFeatureProvider;
import org.calista.phonology.inventory.InventoryGenerator;
import org.calista.phonology.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * PhonologyConfig: простой POJO конфиг:
 * - дефолты в полях
 * - loadOrCreate() создаёт файл, если его нет
 * - validate() нормализует значения
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PhonologyConfig {

    private static final Logger log = LoggerFactory.getLogger(PhonologyConfig.class);

    public Features features = new Features();
    public Learning learning = new Learning();
    public Inventory inventory = new Inventory();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Features {
        /** Файл таблицы признаков. Пусто => ресурс из classpath ниже. */
        public String table = "";
        public String classpathTable = TableFeatureProvider.DEFAULT_RESOURCE;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Learning {
        /** Логировать каждый trace обучения на DEBUG. */
        public boolean traceEnabled = true;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Inventory {
        public int maxKnownFeatures = 20;
        public boolean includeEmptyBundle = true;
        public boolean basicOnlyDefault = true;
    }

    // -------------------- Load / Create --------------------

    /**
     * Загружает конфиг. Если файла нет (или он пустой): создаёт дефолтный и пишет на диск.
     */
    public static PhonologyConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            PhonologyConfig created = new PhonologyConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            PhonologyConfig created = new PhonologyConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        return ConfigReader.bind(json, configFile, mapper);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, PhonologyConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    /** Настройки инвентаря в виде, который принимает генератор. */
    public InventoryGenerator.Config inventoryConfig() {
        InventoryGenerator.Config c = new InventoryGenerator.Config();
        c.maxKnownFeatures = inventory.maxKnownFeatures;
        c.includeEmptyBundle = inventory.includeEmptyBundle;
        return c;
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (features == null) features = new Features();
        if (features.table == null) features.table = "";
        features.table = features.table.trim();
        if (features.classpathTable == null || features.classpathTable.isBlank())
            features.classpathTable = TableFeatureProvider.DEFAULT_RESOURCE;

        if (learning == null) learning = new Learning();

        if (inventory == null) inventory = new Inventory();
        // 2^n кандидатов: больше 20 признаков каталога всё равно не бывает
        if (inventory.maxKnownFeatures < 1) inventory.maxKnownFeatures = 1;
        if (inventory.maxKnownFeatures > 20) inventory.maxKnownFeatures = 20;
    }
}
