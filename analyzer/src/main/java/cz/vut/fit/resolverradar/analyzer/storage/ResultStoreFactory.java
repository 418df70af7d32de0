package cz.vut.fit.resolverradar.analyzer.storage;

import cz.vut.fit.resolverradar.analyzer.AnalyzerSettings;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens a fresh {@link ResultStore}. The caller owns the returned store and must close it.
 */
@FunctionalInterface
public interface ResultStoreFactory {
    @NotNull ResultStore open() throws IOException;

    /**
     * Returns the factory for the storage type selected in the settings.
     *
     * @throws IllegalArgumentException If the storage type is not known.
     */
    static @NotNull ResultStoreFactory fromSettings(@NotNull AnalyzerSettings settings) {
        switch (settings.storageType()) {
            case "postgres":
                return () -> PostgresResultStore.open(settings.dbUrl(), settings.dbUser(), settings.dbPassword());
            case "jsonl":
                final var path = Path.of(settings.jsonlPath());
                return () -> new JsonLinesResultStore(path);
            default:
                throw new IllegalArgumentException("Unknown storage type: " + settings.storageType());
        }
    }
}
