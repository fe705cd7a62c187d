package com.venuearb.core;

import com.venuearb.domain.ArbitrageException;
import com.venuearb.domain.ResourceKey;
import lombok.Getter;

import java.util.Set;

/**
 * Another execution holds at least one of the resources a path needs.
 */
@Getter
public class ResourceBusyException extends ArbitrageException {

    private final Set<ResourceKey> conflicts;

    public ResourceBusyException(String message, Set<ResourceKey> conflicts) {
        super(message);
        this.conflicts = Set.copyOf(conflicts);
    }
}
