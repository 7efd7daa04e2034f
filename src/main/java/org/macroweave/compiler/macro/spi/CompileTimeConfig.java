package org.macroweave.compiler.macro.spi;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Read-only access to compile-time configuration values, e.g. build flags, for macro implementations.
 * <p>
 * Access is a capability: it is only obtainable through a {@link Grant}, which the expansion pass
 * opens when it starts and closes when it ends. Once the grant is closed, every read fails with
 * {@link IllegalStateException}, so no later phase (and no macro that leaked a reference) can
 * read the values. The values are never part of the compiled output.
 */
public final class CompileTimeConfig {

    private final Config values;
    private final AtomicBoolean revoked = new AtomicBoolean(false);

    private CompileTimeConfig(Config values) {
        this.values = values;
    }

    /**
     * Opens access to the given values.
     * @param values The compile-time key-value pairs.
     * @return A grant; close it to revoke access.
     */
    public static Grant grant(Config values) {
        return new Grant(new CompileTimeConfig(values == null ? ConfigFactory.empty() : values));
    }

    public boolean hasPath(String path) {
        return checked().hasPath(path);
    }

    public boolean getBoolean(String path) {
        return checked().getBoolean(path);
    }

    public boolean getBoolean(String path, boolean defaultValue) {
        Config config = checked();
        return config.hasPath(path) ? config.getBoolean(path) : defaultValue;
    }

    public String getString(String path) {
        return checked().getString(path);
    }

    public String getString(String path, String defaultValue) {
        Config config = checked();
        return config.hasPath(path) ? config.getString(path) : defaultValue;
    }

    public int getInt(String path) {
        return checked().getInt(path);
    }

    public int getInt(String path, int defaultValue) {
        Config config = checked();
        return config.hasPath(path) ? config.getInt(path) : defaultValue;
    }

    /**
     * @return {@code true} once the pass that granted access has ended.
     */
    public boolean isRevoked() {
        return revoked.get();
    }

    private Config checked() {
        if (revoked.get()) {
            throw new IllegalStateException("Compile-time configuration is only readable during macro expansion.");
        }
        return values;
    }

    /**
     * The owner's handle on a {@link CompileTimeConfig}. Closing it revokes access.
     */
    public static final class Grant implements AutoCloseable {
        private final CompileTimeConfig config;

        private Grant(CompileTimeConfig config) {
            this.config = config;
        }

        public CompileTimeConfig config() {
            return config;
        }

        @Override
        public void close() {
            config.revoked.set(true);
        }
    }
}
