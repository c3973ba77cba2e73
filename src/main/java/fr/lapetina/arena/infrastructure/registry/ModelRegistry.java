package fr.lapetina.arena.infrastructure.registry;

import fr.lapetina.arena.domain.model.Model;
import fr.lapetina.arena.infrastructure.config.ArenaConfig;
import fr.lapetina.arena.infrastructure.config.ConfigLoader.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Registry of the models that can be drawn into a round.
 *
 * Immutable after construction, so it is safe to share between threads.
 * Iteration order is the configuration order.
 */
public final class ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private final Map<String, Model> models;

    public ModelRegistry(Collection<Model> models) {
        Map<String, Model> byId = new LinkedHashMap<>();
        for (Model model : models) {
            if (byId.putIfAbsent(model.id(), model) != null) {
                throw new ConfigurationException("Duplicate model id: " + model.id());
            }
            log.info("Model registered: id={}, category={}", model.id(), model.category());
        }
        if (byId.size() < 2) {
            throw new ConfigurationException("At least two models are required, got " + byId.size());
        }
        this.models = Collections.unmodifiableMap(byId);
    }

    /**
     * Builds the registry from the {@code models} section of the configuration.
     */
    public static ModelRegistry fromConfig(List<ArenaConfig.ModelConfig> configs) {
        List<Model> models = configs.stream()
                .map(c -> {
                    if (c.getId() == null || c.getId().isBlank()) {
                        throw new ConfigurationException("Model id must not be blank");
                    }
                    return new Model(c.getId(), c.getDisplayName(), c.getCategory(), c.getContextLength());
                })
                .toList();
        return new ModelRegistry(models);
    }

    /**
     * Gets all models in configuration order.
     */
    public List<Model> list() {
        return List.copyOf(models.values());
    }

    /**
     * Gets all model ids in configuration order.
     */
    public List<String> ids() {
        return List.copyOf(models.keySet());
    }

    public Optional<Model> get(String id) {
        return Optional.ofNullable(models.get(id));
    }

    /**
     * Gets a model by id.
     *
     * @throws NoSuchElementException if the id is not registered
     */
    public Model require(String id) {
        Model model = models.get(id);
        if (model == null) {
            throw new NoSuchElementException("Unknown model: " + id);
        }
        return model;
    }

    public boolean contains(String id) {
        return models.containsKey(id);
    }

    public int size() {
        return models.size();
    }
}
