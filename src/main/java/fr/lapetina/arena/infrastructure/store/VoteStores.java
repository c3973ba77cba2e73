package fr.lapetina.arena.infrastructure.store;

import fr.lapetina.arena.infrastructure.config.ArenaConfig;
import fr.lapetina.arena.infrastructure.config.ConfigLoader.ConfigurationException;

import java.nio.file.Paths;
import java.util.Locale;

/**
 * Creates the configured {@link VoteStore}.
 */
public final class VoteStores {

    private VoteStores() {
    }

    public static VoteStore create(ArenaConfig.VoteStoreConfig config) {
        String type = config.getType() == null ? "memory" : config.getType().trim().toLowerCase(Locale.ROOT);
        switch (type) {
            case "memory":
                return new InMemoryVoteStore();
            case "sqlite":
                SqliteVoteStore store = new SqliteVoteStore(Paths.get(config.getPath()));
                try {
                    store.initialize();
                } catch (IllegalStateException e) {
                    throw new ConfigurationException(e.getMessage(), e);
                }
                return store;
            default:
                throw new ConfigurationException("Unknown vote store type: " + config.getType());
        }
    }
}
