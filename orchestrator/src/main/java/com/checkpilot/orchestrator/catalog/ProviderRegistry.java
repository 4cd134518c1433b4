package com.checkpilot.orchestrator.catalog;

import com.checkpilot.orchestrator.model.UnitProblem;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The providers known to this process together with the catalogue built
 * from their units. Constructed explicitly and handed to whoever needs it;
 * sessions work on copies of {@link #catalog()}.
 */
public class ProviderRegistry {

    private final Map<String, Provider> providers = new LinkedHashMap<>();
    private final UnitCatalog catalog;
    private final List<UnitProblem> problems;

    public ProviderRegistry(List<Provider> providers, UnitCatalog catalog, List<UnitProblem> problems) {
        providers.forEach(p -> this.providers.put(p.namespace(), p));
        this.catalog  = catalog;
        this.problems = List.copyOf(problems);
    }

    /** Registry over an in-memory catalogue, without provider directories. */
    public static ProviderRegistry of(UnitCatalog catalog) {
        return new ProviderRegistry(List.of(), catalog, List.of());
    }

    public UnitCatalog catalog() { return catalog; }

    public List<Provider> providers() { return List.copyOf(providers.values()); }

    public Optional<Provider> provider(String namespace) {
        return Optional.ofNullable(providers.get(namespace));
    }

    public Optional<Path> binDirFor(String namespace) {
        return provider(namespace).map(Provider::binDir);
    }

    /** Units that were rejected while loading. */
    public List<UnitProblem> problems() { return problems; }

    public Map<String, Provider> asMap() { return Collections.unmodifiableMap(providers); }
}
