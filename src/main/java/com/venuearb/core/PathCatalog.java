package com.venuearb.core;

import com.venuearb.domain.Asset;
import com.venuearb.domain.BookKey;
import com.venuearb.domain.InvalidPathException;
import com.venuearb.domain.Leg;
import com.venuearb.domain.Pair;
import com.venuearb.domain.Path;
import com.venuearb.domain.PathFamily;
import com.venuearb.domain.Side;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The fixed set of tradeable cycles over the configured venues, built and validated once at
 * startup. Paths are referenced by their index for the life of the process.
 */
@Slf4j
public final class PathCatalog {

    private final Map<String, Set<Pair>> pairsByVenue;
    private final List<Path> paths;
    private final Map<PathFamily, List<Path>> byFamily;
    private final Map<Asset, List<Path>> byAsset;

    private PathCatalog(Map<String, Set<Pair>> pairsByVenue, List<Path> paths) {
        this.pairsByVenue = pairsByVenue;
        this.paths = List.copyOf(paths);

        Map<PathFamily, List<Path>> families = new EnumMap<>(PathFamily.class);
        Map<Asset, List<Path>> assets = new TreeMap<>();
        for (Path path : this.paths) {
            families.computeIfAbsent(path.getFamily(), f -> new ArrayList<>()).add(path);
            for (Asset asset : path.getAssets()) {
                assets.computeIfAbsent(asset, a -> new ArrayList<>()).add(path);
            }
        }
        families.replaceAll((f, list) -> List.copyOf(list));
        assets.replaceAll((a, list) -> List.copyOf(list));
        this.byFamily = Collections.unmodifiableMap(families);
        this.byAsset = Collections.unmodifiableMap(assets);
    }

    /**
     * Builds every cross-venue and triangular cycle the declared pairs allow.
     *
     * @throws InvalidPathException if a generated path breaks the chain rules
     */
    public static PathCatalog build(Map<String, List<Pair>> declared) {
        Map<String, Set<Pair>> venues = new LinkedHashMap<>();
        declared.forEach((venue, pairs) -> venues.put(venue, Collections.unmodifiableSet(new LinkedHashSet<>(pairs))));

        List<Path> paths = new ArrayList<>();
        addCrossVenuePaths(venues, paths);
        for (Map.Entry<String, Set<Pair>> venue : venues.entrySet()) {
            addTriangularPaths(venue.getKey(), venue.getValue(), paths);
        }

        PathCatalog catalog = new PathCatalog(Collections.unmodifiableMap(venues), paths);
        log.info("Path catalog built: {} cross-venue, {} triangular over {} venues",
                catalog.paths(PathFamily.CROSS_VENUE).size(), catalog.paths(PathFamily.TRIANGULAR).size(),
                venues.size());
        return catalog;
    }

    private static void addCrossVenuePaths(Map<String, Set<Pair>> venues, List<Path> out) {
        Map<Pair, List<String>> venuesByPair = new TreeMap<>();
        venues.forEach((venue, pairs) -> pairs.forEach(
                pair -> venuesByPair.computeIfAbsent(pair, p -> new ArrayList<>()).add(venue)));

        for (Map.Entry<Pair, List<String>> entry : venuesByPair.entrySet()) {
            Pair pair = entry.getKey();
            List<String> listing = entry.getValue();
            if (listing.size() < 2) {
                continue;
            }
            for (String buyVenue : listing) {
                for (String sellVenue : listing) {
                    if (buyVenue.equals(sellVenue)) {
                        continue;
                    }
                    out.add(Path.of(out.size(), pair.getQuote(), List.of(
                            Leg.of(buyVenue, pair, Side.BUY),
                            Leg.of(sellVenue, pair, Side.SELL))));
                }
            }
        }
    }

    private static void addTriangularPaths(String venue, Set<Pair> pairs, List<Path> out) {
        Set<Asset> assets = new TreeSet<>();
        pairs.forEach(p -> {
            assets.add(p.getBase());
            assets.add(p.getQuote());
        });
        for (Asset x : assets) {
            for (Asset y : assets) {
                if (y.equals(x)) {
                    continue;
                }
                Optional<Pair> xy = find(pairs, x, y);
                if (xy.isEmpty()) {
                    continue;
                }
                for (Asset z : assets) {
                    if (z.equals(x) || z.equals(y)) {
                        continue;
                    }
                    Optional<Pair> yz = find(pairs, y, z);
                    Optional<Pair> zx = find(pairs, z, x);
                    if (yz.isEmpty() || zx.isEmpty()) {
                        continue;
                    }
                    out.add(Path.of(out.size(), x, List.of(
                            Leg.converting(venue, xy.get(), x, y),
                            Leg.converting(venue, yz.get(), y, z),
                            Leg.converting(venue, zx.get(), z, x))));
                }
            }
        }
    }

    private static Optional<Pair> find(Set<Pair> pairs, Asset a, Asset b) {
        Pair direct = Pair.of(a, b);
        if (pairs.contains(direct)) {
            return Optional.of(direct);
        }
        Pair inverse = Pair.of(b, a);
        return pairs.contains(inverse) ? Optional.of(inverse) : Optional.empty();
    }

    public List<Path> allPaths() {
        return paths;
    }

    public List<Path> paths(PathFamily family) {
        return byFamily.getOrDefault(family, List.of());
    }

    public List<Path> pathsTouching(Asset asset) {
        return byAsset.getOrDefault(asset, List.of());
    }

    public Path path(int index) {
        return paths.get(index);
    }

    /**
     * A pair listed on {@code venue} that converts between the two assets, in either orientation.
     */
    public Optional<Pair> findPair(String venue, Asset a, Asset b) {
        Set<Pair> pairs = pairsByVenue.get(venue);
        if (pairs == null || a.equals(b)) {
            return Optional.empty();
        }
        return find(pairs, a, b);
    }

    public Set<String> venues() {
        return pairsByVenue.keySet();
    }

    public Set<BookKey> bookKeys() {
        Set<BookKey> keys = new LinkedHashSet<>();
        pairsByVenue.forEach((venue, pairs) -> pairs.forEach(p -> keys.add(BookKey.of(venue, p))));
        return keys;
    }

    public int size() {
        return paths.size();
    }
}
