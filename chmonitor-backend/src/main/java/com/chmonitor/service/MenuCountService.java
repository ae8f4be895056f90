package com.chmonitor.service;

import com.chmonitor.api.MenuCountResponse;
import com.chmonitor.model.QueryDefinition;
import com.chmonitor.model.QueryDefinitionFile;
import com.chmonitor.model.QueryMetadata;
import com.chmonitor.model.QueryRequest;
import com.chmonitor.model.QueryResult;
import com.chmonitor.query.QueryDefinitionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * Counts shown next to navigation entries.
 *
 * <p>Only keys registered in the {@code menu-count} category can be counted; no SQL is accepted
 * from callers.
 */
@Slf4j
@Service
public class MenuCountService {
    private static final Pattern KEY_FORMAT = Pattern.compile("[a-z0-9][a-z0-9-]{0,63}");

    private final QueryDefinitionRegistry registry;
    private final QueryExecutor queryExecutor;

    public MenuCountService(QueryDefinitionRegistry registry, QueryExecutor queryExecutor) {
        this.registry = registry;
        this.queryExecutor = queryExecutor;
    }

    public List<String> keys() {
        return registry.names(QueryDefinitionFile.CATEGORY_MENU_COUNT);
    }

    /**
     * Runs the count query registered under {@code key}.
     *
     * @param key count key
     * @param hostId host id
     * @return count; optional counts degrade every failure to {@code count = null}
     * @throws QueryValidationException when the key is malformed
     * @throws QueryDefinitionNotFoundException when the key is not registered
     */
    public CompletableFuture<QueryResult<MenuCountResponse>> count(String key, int hostId) {
        if (key == null || !KEY_FORMAT.matcher(key).matches()) {
            throw new QueryValidationException("Invalid count key format: " + key);
        }
        QueryDefinition definition = registry.get(QueryDefinitionFile.CATEGORY_MENU_COUNT, key);

        QueryRequest request = QueryRequest.builder()
                .hostId(hostId)
                .format("JSONEachRow")
                .definition(definition)
                .build();

        return queryExecutor.execute(request).thenApply(result -> {
            if (result.isSuccess()) {
                return result.map(MenuCountService::extractCount);
            }
            if (definition.isOptional()) {
                log.debug("Optional count '{}' unavailable on host {}: {}", key, hostId, result.getError().getMessage());
                QueryMetadata metadata = QueryMetadata.builder()
                        .queryId("menu-count-" + key)
                        .rows(1)
                        .host(result.getMetadata() != null ? result.getMetadata().getHost() : null)
                        .build();
                return QueryResult.success(new MenuCountResponse(null), metadata);
            }
            log.error("Count '{}' failed on host {}: {}", key, hostId, result.getError().getMessage());
            return QueryResult.<MenuCountResponse>failure(result.getError(), result.getMetadata());
        });
    }

    static MenuCountResponse extractCount(List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) {
            return new MenuCountResponse(0L);
        }
        Map<String, Object> row = rows.get(0);
        Object value = row.containsKey("count") ? row.get("count") : row.values().stream().findFirst().orElse(null);
        if (value == null) {
            return new MenuCountResponse(null);
        }
        if (value instanceof Number n) {
            return new MenuCountResponse(n.longValue());
        }
        try {
            return new MenuCountResponse(Long.parseLong(value.toString().trim()));
        } catch (NumberFormatException e) {
            log.warn("Non-numeric count value: {}", value);
            return new MenuCountResponse(null);
        }
    }
}
