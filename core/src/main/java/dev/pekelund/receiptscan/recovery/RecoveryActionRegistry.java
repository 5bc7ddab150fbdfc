package dev.pekelund.receiptscan.recovery;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.util.Assert;

/**
 * Maps a watched service name to its candidate recovery actions, ordered by descending priority.
 */
public class RecoveryActionRegistry {

    private static final Comparator<RecoveryAction> BY_PRIORITY =
        Comparator.comparingInt(RecoveryAction::priority).reversed();

    private final ConcurrentMap<String, List<RecoveryAction>> actions = new ConcurrentHashMap<>();

    public RecoveryActionRegistry register(String service, RecoveryAction action) {
        Assert.hasText(service, "Service name must not be empty");
        Assert.notNull(action, "Recovery action must not be null");
        actions.computeIfAbsent(service, key -> new CopyOnWriteArrayList<>()).add(action);
        return this;
    }

    public boolean isKnown(String service) {
        return service != null && actions.containsKey(service);
    }

    public Set<String> services() {
        return Set.copyOf(actions.keySet());
    }

    /**
     * @return actions for the service, highest priority first; empty for unknown services
     */
    public List<RecoveryAction> actionsFor(String service) {
        List<RecoveryAction> registered = service != null ? actions.get(service) : null;
        if (registered == null) {
            return List.of();
        }
        List<RecoveryAction> sorted = new ArrayList<>(registered);
        sorted.sort(BY_PRIORITY);
        return sorted;
    }

    public Map<String, List<RecoveryActionDescriptor>> descriptors() {
        Map<String, List<RecoveryActionDescriptor>> result = new LinkedHashMap<>();
        actions.keySet().stream().sorted().forEach(service -> result.put(service,
            actionsFor(service).stream().map(RecoveryAction::descriptor).toList()));
        return result;
    }
}
