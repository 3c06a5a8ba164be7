package io.akuity.namespaceclass.operator.store;

import io.akuity.namespaceclass.operator.error.ErrorKind;
import io.kubernetes.client.Discovery;
import io.kubernetes.client.openapi.ApiException;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves {@code apiVersion}/{@code kind} pairs to REST plurals using API discovery.
 * Results are cached; a miss triggers one rediscovery so that newly installed CRDs are picked up.
 * A kind that is still not served after rediscovery resolves to {@link ErrorKind#NOT_FOUND}.
 */
@Slf4j
public class KindResolver {
    private final Discovery discovery;
    private final Map<String, ResourceKind> kinds = new ConcurrentHashMap<>();

    public KindResolver(Discovery discovery) {
        this.discovery = discovery;
    }

    public StoreResult<ResourceKind> resolve(String group, String version, String kind) {
        ResourceKind cached = kinds.get(cacheKey(group, version, kind));
        if (cached != null) {
            return StoreResult.ok(cached);
        }

        StoreResult<Void> refreshed = refresh();
        if (!refreshed.isSuccess()) {
            return refreshed.asFailure();
        }

        ResourceKind resolved = kinds.get(cacheKey(group, version, kind));
        if (resolved == null) {
            String apiVersion = group.isEmpty() ? version : group + "/" + version;
            return StoreResult.failure(ErrorKind.NOT_FOUND,
                    "no API resource serves kind " + kind + " in " + apiVersion);
        }
        return StoreResult.ok(resolved);
    }

    private synchronized StoreResult<Void> refresh() {
        try {
            Set<Discovery.APIResource> resources = discovery.findAll();
            for (Discovery.APIResource resource : resources) {
                for (String version : resource.getVersions()) {
                    kinds.put(cacheKey(resource.getGroup(), version, resource.getKind()),
                            new ResourceKind(resource.getGroup(), version, resource.getResourcePlural(),
                                    Boolean.TRUE.equals(resource.getNamespaced())));
                }
            }
            log.debug("Discovered {} API resources", resources.size());
            return StoreResult.ok();
        } catch (ApiException e) {
            log.warn("API discovery failed: {}", e.getMessage());
            return ApiResponses.fromApiException(e);
        }
    }

    private static String cacheKey(String group, String version, String kind) {
        return (group == null ? "" : group) + "/" + version + "/" + kind;
    }
}
