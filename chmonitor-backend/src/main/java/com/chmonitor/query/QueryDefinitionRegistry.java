package com.chmonitor.query;

import com.chmonitor.model.EngineVersion;
import com.chmonitor.model.QueryDefinition;
import com.chmonitor.model.QueryDefinitionFile;
import com.chmonitor.model.VersionedSql;
import com.chmonitor.service.QueryDefinitionNotFoundException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named query definitions loaded from YAML files on the classpath.
 *
 * <p>Each file declares a {@code category} and a list of queries. A query name is unique within
 * its category.
 */
@Component
public class QueryDefinitionRegistry {
    private static final Logger log = LoggerFactory.getLogger(QueryDefinitionRegistry.class);

    private final ResourcePatternResolver resourceResolver;
    private final String location;

    private volatile Map<String, Map<String, QueryDefinition>> definitionsByCategory = Map.of();

    @Autowired
    public QueryDefinitionRegistry(@Value("${chmonitor.queries.location:classpath*:queries/*.yaml}") String location) {
        this(new PathMatchingResourcePatternResolver(), location);
    }

    QueryDefinitionRegistry(ResourcePatternResolver resourceResolver, String location) {
        this.resourceResolver = resourceResolver;
        this.location = location;
    }

    @PostConstruct
    public void loadDefinitions() {
        reload();
    }

    /**
     * Reloads every definition file.
     *
     * <p>The new definitions are collected into a fresh map which then replaces the current one,
     * so readers never see a partially loaded registry.
     */
    public void reload() {
        Map<String, Map<String, QueryDefinition>> loaded = new LinkedHashMap<>();
        Resource[] resources;
        try {
            resources = resourceResolver.getResources(location);
        } catch (Exception e) {
            log.error("Failed to list query definition files at {}", location, e);
            return;
        }

        for (Resource resource : resources) {
            try {
                QueryDefinitionFile file = loadFile(resource);
                if (file == null) {
                    log.warn("Empty query definition file: {}", resource.getFilename());
                    continue;
                }
                file.setSourceFile(resource.getFilename());
                register(loaded, file);
            } catch (Exception e) {
                log.error("Failed to load query definition file: {}", resource.getFilename(), e);
            }
        }

        Map<String, Map<String, QueryDefinition>> frozen = new LinkedHashMap<>();
        loaded.forEach((category, defs) -> frozen.put(category, Collections.unmodifiableMap(defs)));
        definitionsByCategory = Collections.unmodifiableMap(frozen);
        log.info("Loaded query definitions: {}", summary(frozen));
    }

    public Optional<QueryDefinition> find(String category, String name) {
        Map<String, QueryDefinition> defs = definitionsByCategory.get(category);
        return defs == null ? Optional.empty() : Optional.ofNullable(defs.get(name));
    }

    public QueryDefinition get(String category, String name) {
        return find(category, name)
                .orElseThrow(() -> new QueryDefinitionNotFoundException(
                        "Unknown " + category + " '" + name + "'. Available: " + names(category)));
    }

    public List<String> names(String category) {
        Map<String, QueryDefinition> defs = definitionsByCategory.get(category);
        return defs == null ? List.of() : List.copyOf(defs.keySet());
    }

    /**
     * Whether {@code sql} is the text of any registered variant, in any category.
     *
     * @param sql statement text; surrounding whitespace is ignored
     * @return {@code true} when a definition carries exactly this statement
     */
    public boolean isRegisteredSql(String sql) {
        if (sql == null || sql.isBlank()) {
            return false;
        }
        String wanted = sql.trim();
        for (Map<String, QueryDefinition> defs : definitionsByCategory.values()) {
            for (QueryDefinition def : defs.values()) {
                for (VersionedSql variant : def.getSql()) {
                    if (wanted.equals(variant.getSql().trim())) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private QueryDefinitionFile loadFile(Resource resource) throws Exception {
        try (InputStream in = resource.getInputStream()) {
            return new Yaml().loadAs(in, QueryDefinitionFile.class);
        }
    }

    private void register(Map<String, Map<String, QueryDefinition>> target, QueryDefinitionFile file) {
        String category = file.getCategory() == null || file.getCategory().isBlank()
                ? QueryDefinitionFile.CATEGORY_QUERY
                : file.getCategory().trim();
        Map<String, QueryDefinition> defs = target.computeIfAbsent(category, c -> new LinkedHashMap<>());

        for (QueryDefinition def : file.getQueries()) {
            String problem = validate(def);
            if (problem != null) {
                log.error("Skipping query in {}: {}", file.getSourceFile(), problem);
                continue;
            }
            if (defs.containsKey(def.getName())) {
                log.error("Duplicate {} '{}' in {}, keeping the first definition",
                        category, def.getName(), file.getSourceFile());
                continue;
            }
            defs.put(def.getName(), def);
            log.debug("Registered {} '{}' from {}", category, def.getName(), file.getSourceFile());
        }
    }

    static String validate(QueryDefinition def) {
        if (def == null) {
            return "empty entry";
        }
        if (def.getName() == null || def.getName().isBlank()) {
            return "query without a name";
        }
        if (def.getSql() == null || def.getSql().isEmpty()) {
            return "query '" + def.getName() + "' has no sql";
        }
        for (VersionedSql variant : def.getSql()) {
            if (variant.getSql() == null || variant.getSql().isBlank()) {
                return "query '" + def.getName() + "' has an empty sql variant";
            }
            try {
                EngineVersion.parse(variant.getSince());
            } catch (IllegalArgumentException e) {
                return "query '" + def.getName() + "' has an invalid since: " + variant.getSince();
            }
        }
        return null;
    }

    private static String summary(Map<String, Map<String, QueryDefinition>> defs) {
        StringBuilder sb = new StringBuilder();
        defs.forEach((category, byName) -> {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(category).append('=').append(byName.size());
        });
        return sb.length() == 0 ? "<none>" : sb.toString();
    }
}
