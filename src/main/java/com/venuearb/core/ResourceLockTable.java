package com.venuearb.core;

import com.venuearb.domain.Asset;
import com.venuearb.domain.ResourceKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Exclusive ownership of (venue, asset) balances. A claim takes every requested key or none of
 * them; conflicting claims fail immediately instead of waiting.
 */
@Slf4j
@Component
public class ResourceLockTable {

    private final Map<ResourceKey, String> owners = new HashMap<>();

    /**
     * @throws ResourceBusyException if any key is held by a different owner
     */
    public synchronized void acquire(String owner, Collection<ResourceKey> keys) {
        Set<ResourceKey> conflicts = new LinkedHashSet<>();
        for (ResourceKey key : keys) {
            String holder = owners.get(key);
            if (holder != null && !holder.equals(owner)) {
                conflicts.add(key);
            }
        }
        if (!conflicts.isEmpty()) {
            throw new ResourceBusyException("Resources " + conflicts + " are held by another execution", conflicts);
        }
        keys.forEach(key -> owners.put(key, owner));
        log.debug("{} locked {}", owner, keys);
    }

    public synchronized boolean tryAcquire(String owner, Collection<ResourceKey> keys) {
        try {
            acquire(owner, keys);
            return true;
        } catch (ResourceBusyException e) {
            return false;
        }
    }

    public synchronized int release(String owner) {
        int before = owners.size();
        owners.values().removeIf(owner::equals);
        int released = before - owners.size();
        log.debug("{} released {} resources", owner, released);
        return released;
    }

    public synchronized boolean isLocked(String venue, Asset asset) {
        return owners.containsKey(ResourceKey.of(venue, asset));
    }

    /**
     * Whether the asset is locked on any venue.
     */
    public synchronized boolean isAssetLocked(Asset asset) {
        return owners.keySet().stream().anyMatch(k -> k.getAsset().equals(asset));
    }

    public synchronized Map<ResourceKey, String> snapshot() {
        return Map.copyOf(owners);
    }
}
