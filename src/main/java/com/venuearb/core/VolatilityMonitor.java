package com.venuearb.core;

import com.venuearb.config.ArbProperties;
import com.venuearb.domain.Asset;
import com.venuearb.domain.BookKey;
import com.venuearb.domain.OrderBookSnapshot;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling window of mid prices per book. An asset's volatility is the largest relative standard
 * deviation, in percent, over the books where it is the base asset.
 */
@Component
public class VolatilityMonitor implements SnapshotListener {

    private static final MathContext MC = MathContext.DECIMAL128;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final Map<BookKey, Deque<BigDecimal>> mids = new ConcurrentHashMap<>();
    private final SnapshotCache cache;
    private final int window;
    private final int minSamples;

    public VolatilityMonitor(SnapshotCache cache, ArbProperties properties) {
        this.cache = cache;
        this.window = properties.risk().volatilityWindow();
        this.minSamples = properties.risk().volatilityMinSamples();
    }

    @PostConstruct
    void register() {
        cache.addListener(this);
    }

    @Override
    public void onSnapshot(OrderBookSnapshot snapshot) {
        BigDecimal mid = snapshot.midPrice();
        if (mid == null) {
            return;
        }
        Deque<BigDecimal> samples = mids.computeIfAbsent(snapshot.bookKey(), k -> new ArrayDeque<>());
        synchronized (samples) {
            samples.addLast(mid);
            while (samples.size() > window) {
                samples.removeFirst();
            }
        }
    }

    public Optional<BigDecimal> volatilityPct(Asset asset) {
        BigDecimal worst = null;
        for (Map.Entry<BookKey, Deque<BigDecimal>> entry : mids.entrySet()) {
            if (!entry.getKey().getPair().getBase().equals(asset)) {
                continue;
            }
            List<BigDecimal> samples;
            synchronized (entry.getValue()) {
                samples = new ArrayList<>(entry.getValue());
            }
            Optional<BigDecimal> vol = relativeStdDevPct(samples);
            if (vol.isPresent() && (worst == null || vol.get().compareTo(worst) > 0)) {
                worst = vol.get();
            }
        }
        return Optional.ofNullable(worst);
    }

    Optional<BigDecimal> relativeStdDevPct(List<BigDecimal> samples) {
        if (samples.size() < minSamples) {
            return Optional.empty();
        }
        BigDecimal n = BigDecimal.valueOf(samples.size());
        BigDecimal mean = samples.stream().reduce(BigDecimal.ZERO, BigDecimal::add).divide(n, MC);
        if (mean.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal variance = samples.stream()
                .map(x -> x.subtract(mean).pow(2, MC))
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(n, MC);
        return Optional.of(variance.sqrt(MC).divide(mean, MC).multiply(HUNDRED, MC));
    }

    public void reset() {
        mids.clear();
    }
}
