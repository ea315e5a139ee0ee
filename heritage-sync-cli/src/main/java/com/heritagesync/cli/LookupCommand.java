package com.heritagesync.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.heritagesync.core.index.ComponentIndex;
import com.heritagesync.core.model.ComponentSite;
import com.heritagesync.core.model.HeritageSite;
import com.heritagesync.core.model.VisitScope;
import com.heritagesync.core.publish.DatasetSerializer;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to resolve a visit key against a published dataset.
 *
 * <p>A visit key is either a component id ({@code Q29583927}) or a whole-property key
 * ({@code property:438}).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * heritagesync lookup data/sites.json Q29583927
 * heritagesync lookup data/sites.json property:438
 * }</pre>
 */
@Command(
    name = "lookup",
    description = "Resolve a visit key to the property it belongs to",
    mixinStandardHelpOptions = true
)
public class LookupCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(LookupCommand.class);

    @Parameters(index = "0", description = "Dataset file")
    private Path datasetFile;

    @Parameters(index = "1", description = "Visit key: component id or property:<siteId>")
    private String visitKey;

    @Override
    public Integer call() {
        try {
            if (!Files.isRegularFile(datasetFile)) {
                System.err.println("✗ Dataset not found: " + datasetFile);
                return 1;
            }

            VisitScope scope = VisitScope.decode(visitKey);
            ComponentIndex index = new ComponentIndex(new DatasetSerializer().read(datasetFile));
            log.debug("Indexed {} sites and {} components", index.siteCount(), index.componentCount());

            Optional<HeritageSite> site = index.resolveSiteId(scope).flatMap(index::site);
            if (site.isEmpty()) {
                System.err.println("✗ No property found for visit key: " + visitKey);
                return 1;
            }

            HeritageSite property = site.get();
            System.out.println("✓ " + scope.encode() + " → property " + property.id() + " (" + property.displayName("en") + ")");
            if (scope instanceof VisitScope.ComponentScope component) {
                index.find(component.componentId()).map(ComponentSite::wikidataUri)
                    .ifPresent(uri -> System.out.println("  → " + uri));
            }
            System.out.println("  → " + property.componentCount() + " component(s)");
            return 0;

        } catch (IllegalArgumentException e) {
            log.error("Invalid visit key: {}", visitKey, e);
            System.err.println("✗ Invalid visit key: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Lookup failed", e);
            System.err.println("✗ Lookup failed: " + e.getMessage());
            return 1;
        }
    }
}
