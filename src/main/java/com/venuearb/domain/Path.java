package com.venuearb.domain;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A closed, chain-valid sequence of legs starting and ending in {@link #getStartAsset()}.
 * Instances only exist if every rule checked in {@link #of} holds.
 */
@Getter
public final class Path {

    private final int index;
    private final PathFamily family;
    private final Asset startAsset;
    private final List<Leg> legs;
    private final Set<Asset> assets;
    private final Set<ResourceKey> resources;

    private Path(int index, PathFamily family, Asset startAsset, List<Leg> legs) {
        this.index = index;
        this.family = family;
        this.startAsset = startAsset;
        this.legs = List.copyOf(legs);
        Set<Asset> touched = new LinkedHashSet<>();
        Set<ResourceKey> keys = new LinkedHashSet<>();
        for (Leg leg : legs) {
            touched.add(leg.consumed());
            touched.add(leg.received());
            keys.add(ResourceKey.of(leg.getVenue(), leg.consumed()));
            keys.add(ResourceKey.of(leg.getVenue(), leg.received()));
        }
        this.assets = Collections.unmodifiableSet(touched);
        this.resources = Collections.unmodifiableSet(keys);
    }

    public static Path of(int index, Asset startAsset, List<Leg> legs) {
        if (startAsset == null || legs == null) {
            throw new InvalidPathException("Path needs a start asset and legs");
        }
        PathFamily family = switch (legs.size()) {
            case 2 -> PathFamily.CROSS_VENUE;
            case 3 -> PathFamily.TRIANGULAR;
            default -> throw new InvalidPathException("Path must have 2 or 3 legs, got " + legs.size());
        };
        validateChain(startAsset, legs);
        if (family == PathFamily.CROSS_VENUE) {
            validateCrossVenue(legs);
        } else {
            validateTriangle(legs);
        }
        return new Path(index, family, startAsset, legs);
    }

    private static void validateChain(Asset startAsset, List<Leg> legs) {
        if (!legs.get(0).consumed().equals(startAsset)) {
            throw new InvalidPathException("First leg " + legs.get(0) + " does not consume " + startAsset);
        }
        for (int i = 0; i + 1 < legs.size(); i++) {
            Asset out = legs.get(i).received();
            Asset in = legs.get(i + 1).consumed();
            if (!out.equals(in)) {
                throw new InvalidPathException("Broken chain: leg " + (i + 1) + " yields " + out
                        + " but leg " + (i + 2) + " consumes " + in);
            }
        }
        Asset last = legs.get(legs.size() - 1).received();
        if (!last.equals(startAsset)) {
            throw new InvalidPathException("Path ends in " + last + " instead of " + startAsset);
        }
    }

    private static void validateCrossVenue(List<Leg> legs) {
        Leg first = legs.get(0);
        Leg second = legs.get(1);
        if (!first.getPair().equals(second.getPair())) {
            throw new InvalidPathException("Cross-venue legs must share one pair: " + legs);
        }
        if (Objects.equals(first.getVenue(), second.getVenue())) {
            throw new InvalidPathException("Cross-venue legs must use two venues: " + legs);
        }
    }

    private static void validateTriangle(List<Leg> legs) {
        Set<String> venues = legs.stream().map(Leg::getVenue).collect(Collectors.toSet());
        if (venues.size() != 1) {
            throw new InvalidPathException("Triangular legs must share one venue: " + legs);
        }
        Set<Pair> pairs = legs.stream().map(Leg::getPair).collect(Collectors.toSet());
        if (pairs.size() != 3) {
            throw new InvalidPathException("Triangular legs must use three distinct pairs: " + legs);
        }
        Set<Asset> assets = legs.stream().map(Leg::consumed).collect(Collectors.toSet());
        if (assets.size() != 3) {
            throw new InvalidPathException("Triangle must visit exactly three assets: " + legs);
        }
    }

    public int size() {
        return legs.size();
    }

    public Leg leg(int i) {
        return legs.get(i);
    }

    public boolean touches(Asset asset) {
        return assets.contains(asset);
    }

    /**
     * Legs that must be funded from an existing balance: the first leg, and any leg placed on a
     * different venue than the one before it.
     */
    public boolean isFundedLeg(int i) {
        return i == 0 || !legs.get(i).getVenue().equals(legs.get(i - 1).getVenue());
    }

    public String id() {
        return legs.stream().map(Leg::toString).collect(Collectors.joining(" -> ", startAsset + ": ", ""));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Path)) {
            return false;
        }
        Path other = (Path) o;
        return index == other.index && startAsset.equals(other.startAsset) && legs.equals(other.legs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, startAsset, legs);
    }

    @Override
    public String toString() {
        return "#" + index + " " + id();
    }
}
