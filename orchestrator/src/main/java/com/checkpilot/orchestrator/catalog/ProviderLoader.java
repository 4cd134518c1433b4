package com.checkpilot.orchestrator.catalog;

import com.checkpilot.orchestrator.model.JobDefinition;
import com.checkpilot.orchestrator.model.Unit;
import com.checkpilot.orchestrator.model.UnitFactory;
import com.checkpilot.orchestrator.model.UnitProblem;
import com.checkpilot.orchestrator.model.UnitValidationException;
import com.checkpilot.orchestrator.resolver.DependencyCycleException;
import com.checkpilot.orchestrator.resolver.DependencySolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Builds the {@link ProviderRegistry} from a directory of providers.
 *
 * Layout of one provider:
 * <pre>
 *   &lt;provider&gt;/manifest.pxu   namespace, name, version
 *   &lt;provider&gt;/units/*.pxu    unit records
 *   &lt;provider&gt;/bin/           optional executables
 * </pre>
 *
 * Invalid units are reported and left out; they never stop the rest of the
 * provider from loading. Jobs taking part in a dependency cycle are left out
 * the same way.
 */
@Component
public class ProviderLoader {

    private static final Logger log = LoggerFactory.getLogger(ProviderLoader.class);

    static final String MANIFEST  = "manifest.pxu";
    static final String UNITS_DIR = "units";
    static final String BIN_DIR   = "bin";

    private final Path providersDir;

    public ProviderLoader(@Value("${checkpilot.providers.dir:providers}") String providersDir) {
        this.providersDir = Path.of(providersDir);
    }

    public ProviderRegistry load() {
        List<Path> roots = new ArrayList<>();
        if (Files.isDirectory(providersDir)) {
            try (Stream<Path> s = Files.list(providersDir)) {
                s.filter(p -> Files.isRegularFile(p.resolve(MANIFEST))).sorted().forEach(roots::add);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot list providers in " + providersDir, e);
            }
        } else {
            log.warn("Provider directory {} does not exist, starting with an empty catalogue", providersDir);
        }
        return load(roots);
    }

    public ProviderRegistry load(List<Path> providerRoots) {
        UnitCatalog catalog = new UnitCatalog();
        List<UnitProblem> problems = new ArrayList<>();
        List<Provider> providers = new ArrayList<>();

        for (Path root : providerRoots) {
            Provider provider = readManifest(root);
            providers.add(provider);
            int before = catalog.size();
            for (Path file : unitFiles(root)) {
                loadFile(provider, file, catalog, problems);
            }
            log.info("Loaded provider {} {} ({}): {} unit(s)",
                    provider.name(), provider.version(), provider.namespace(), catalog.size() - before);
        }
        pruneCycles(catalog, problems);

        problems.forEach(p -> log.warn("Unit rejected: {}", p));
        return new ProviderRegistry(providers, catalog, problems);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Provider readManifest(Path root) {
        Path manifest = root.resolve(MANIFEST);
        List<Map<String, String>> records = RecordParser.parse(read(manifest), manifest.toString());
        if (records.isEmpty() || !records.get(0).containsKey("namespace")) {
            throw new IllegalStateException(manifest + " does not declare a namespace");
        }
        Map<String, String> m = records.get(0);
        String namespace = m.get("namespace");
        Path bin = root.resolve(BIN_DIR);
        return new Provider(namespace,
                m.getOrDefault("name", namespace),
                m.getOrDefault("version", "0"),
                root,
                Files.isDirectory(bin) ? bin : null);
    }

    private List<Path> unitFiles(Path root) {
        Path units = root.resolve(UNITS_DIR);
        if (!Files.isDirectory(units)) {
            return List.of();
        }
        try (Stream<Path> s = Files.list(units)) {
            return s.filter(p -> p.getFileName().toString().endsWith(".pxu")).sorted().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list units in " + units, e);
        }
    }

    private void loadFile(Provider provider, Path file, UnitCatalog catalog, List<UnitProblem> problems) {
        RecordParser.Result parsed = RecordParser.parseLenient(read(file), file.toString());
        if (!parsed.isClean()) {
            problems.add(new UnitProblem(null, file.toString(), parsed.error().getMessage()));
        }
        for (Map<String, String> fields : parsed.records()) {
            try {
                Unit unit = UnitFactory.create(provider.namespace(), fields);
                if (catalog.add(unit) == UnitCatalog.AddResult.CONFLICT) {
                    problems.add(new UnitProblem(unit.id(), file.toString(), "duplicate unit id"));
                }
            } catch (UnitValidationException e) {
                problems.add(new UnitProblem(e.getUnitId(), file.toString(), e.getMessage()));
            }
        }
    }

    private static void pruneCycles(UnitCatalog catalog, List<UnitProblem> problems) {
        while (true) {
            try {
                List<JobDefinition> jobs = catalog.jobs();
                DependencySolver.checkAcyclic(jobs);
                return;
            } catch (DependencyCycleException e) {
                for (String id : new LinkedHashSet<>(e.getCycle())) {
                    problems.add(new UnitProblem(id, "dependency graph", e.getMessage()));
                }
                catalog.removeAll(new LinkedHashSet<>(e.getCycle()));
            }
        }
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
    }
}
