package com.heritagesync.core.index;

import com.heritagesync.core.model.ComponentSite;
import com.heritagesync.core.model.HeritageSite;
import com.heritagesync.core.model.VisitScope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only lookup over a published site list.
 *
 * <p>This is the contract with the per-user visit tracking that consumes the dataset: a
 * visit is recorded either against a component id or, for a property without components,
 * against a {@code property:<siteId>} key. {@link #resolveSiteId(VisitScope)} maps both
 * forms back to the owning property.
 *
 * <p>The index is built once from an immutable list and never changes. Component ids are
 * expected to be unique; when they are not, the first owner wins and
 * {@link #duplicateComponentIds()} reports the collision.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ComponentIndex index = new ComponentIndex(sites);
 * Optional<String> siteId = index.resolveSiteId(VisitScope.decode("Q29583927"));
 * }</pre>
 */
public final class ComponentIndex {

    private final Map<String, HeritageSite> sitesById;
    private final Map<String, ComponentSite> componentsById;
    private final Set<String> duplicateComponentIds;

    /**
     * Builds the index.
     *
     * @param sites published sites
     */
    public ComponentIndex(List<HeritageSite> sites) {
        Map<String, HeritageSite> bySite = new LinkedHashMap<>();
        Map<String, ComponentSite> byComponent = new LinkedHashMap<>();
        Set<String> duplicates = new LinkedHashSet<>();

        for (HeritageSite site : sites) {
            bySite.putIfAbsent(site.id(), site);
            for (ComponentSite component : site.components()) {
                if (byComponent.putIfAbsent(component.componentId(), component) != null) {
                    duplicates.add(component.componentId());
                }
            }
        }

        this.sitesById = Collections.unmodifiableMap(bySite);
        this.componentsById = Collections.unmodifiableMap(byComponent);
        this.duplicateComponentIds = Collections.unmodifiableSet(duplicates);
    }

    /**
     * Finds a component by id.
     *
     * @param componentId component id
     * @return component, or empty
     */
    public Optional<ComponentSite> find(String componentId) {
        return Optional.ofNullable(componentsById.get(componentId));
    }

    /**
     * Returns the components of a site.
     *
     * @param siteId site id
     * @return components in published order, empty for unknown sites
     */
    public List<ComponentSite> componentsOf(String siteId) {
        HeritageSite site = sitesById.get(siteId);
        return site == null ? List.of() : site.components();
    }

    /**
     * Finds a site by id.
     *
     * @param siteId site id
     * @return site, or empty
     */
    public Optional<HeritageSite> site(String siteId) {
        return Optional.ofNullable(sitesById.get(siteId));
    }

    /**
     * Resolves the property a visit scope belongs to.
     *
     * @param scope visit scope
     * @return owning site id, or empty when the scope references nothing in this dataset
     */
    public Optional<String> resolveSiteId(VisitScope scope) {
        if (scope instanceof VisitScope.PropertyScope property) {
            return sitesById.containsKey(property.siteId()) ? Optional.of(property.siteId()) : Optional.empty();
        }
        VisitScope.ComponentScope component = (VisitScope.ComponentScope) scope;
        return find(component.componentId()).map(ComponentSite::parentId);
    }

    /**
     * Returns component ids owned by more than one entry.
     *
     * @return duplicate ids in first-seen order
     */
    public Set<String> duplicateComponentIds() {
        return duplicateComponentIds;
    }

    /**
     * Returns all sites.
     *
     * @return sites in published order
     */
    public List<HeritageSite> sites() {
        return new ArrayList<>(sitesById.values());
    }

    public int siteCount() {
        return sitesById.size();
    }

    public int componentCount() {
        return componentsById.size();
    }
}
