package org.calista.phonology.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.phonology.feature.FeatureProvider;
import org.calista.phonology.feature.impl.TableFeatureProvider;
import org.calista.phonology.grammar.InMemoryGrammarStore;
import org.calista.phonology.io.FileIO;
import org.calista.phonology.session.GrammarSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * PhonologyKernel: instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(configFile) -> loadOrCreate config + load feature table (fail fast on bad feature names)
 *   2) newSession()      -> independent grammar per caller
 *
 * No static singletons: the feature provider is shared read-only, every grammar is owned by
 * exactly one session.
 */
public final class PhonologyKernel {

    private static final Logger log = LoggerFactory.getLogger(PhonologyKernel.class);

    private final PhonologyConfig cfg;
    private final FeatureProvider provider;

    private final AtomicLong sessions = new AtomicLong();

    private PhonologyKernel(PhonologyConfig cfg, FeatureProvider provider) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Path configRoot = Path.of(".");
        private FeatureProvider featureProvider;

        /** Directory relative config and feature table paths resolve against. */
        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        /** Overrides the configured feature table. */
        public Builder featureProvider(FeatureProvider provider) {
            this.featureProvider = Objects.requireNonNull(provider, "featureProvider");
            return this;
        }

        public PhonologyKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = defaultMapper();
            FileIO io = new FileIO(configRoot, StandardCharsets.UTF_8, true);

            Path cfgPath = io.resolve(configFile);
            PhonologyConfig cfg = PhonologyConfig.loadOrCreate(io, cfgPath, om);

            FeatureProvider fp = (this.featureProvider != null) ? this.featureProvider : loadProvider(io, om, cfg);

            PhonologyKernel k = new PhonologyKernel(cfg, fp);
            log.info("PhonologyKernel created: config={}, featureTable={}",
                    cfgPath, featureProvider != null ? "<injected>" : describeTable(cfg));
            return k;
        }

        private static FeatureProvider loadProvider(FileIO io, ObjectMapper om, PhonologyConfig cfg) throws IOException {
            if (!cfg.features.table.isEmpty()) {
                Path table = io.resolve(cfg.features.table);
                return TableFeatureProvider.fromJson(io.readString(table), om);
            }
            return TableFeatureProvider.fromClasspath(cfg.features.classpathTable, om);
        }

        private static String describeTable(PhonologyConfig cfg) {
            return cfg.features.table.isEmpty() ? "classpath:" + cfg.features.classpathTable : cfg.features.table;
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Sessions
    // ---------------------------------------------------------------------

    /** Fresh grammar, owned by the returned session only. */
    public GrammarSession newSession() {
        String id = "sess-" + sessions.incrementAndGet();
        GrammarSession s = new GrammarSession(id, provider, new InMemoryGrammarStore(),
                cfg.learning.traceEnabled, cfg.inventoryConfig());
        log.debug("New session {}", id);
        return s;
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public PhonologyConfig config() { return cfg; }
    public FeatureProvider featureProvider() { return provider; }
}
