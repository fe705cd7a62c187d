package com.venuearb.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuearb.config.ArbProperties;
import com.venuearb.domain.BookKey;
import com.venuearb.domain.OrderBookSnapshot;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Replays recorded frames of books, one frame per tick. Every book is stamped with the time it
 * is emitted so the cache treats it as fresh.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "arb.replay", name = "enabled", havingValue = "true")
public class ReplayBookFeed implements BookFeed {

    private final ArbProperties.Replay config;
    private final ResourceLoader resources;
    private final ObjectMapper mapper;
    private final Clock clock;

    private final List<JsonNode> frames = new ArrayList<>();
    private volatile Set<BookKey> wanted = Set.of();
    private volatile Consumer<OrderBookSnapshot> sink;
    private int cursor;

    public ReplayBookFeed(ArbProperties properties, ResourceLoader resources, ObjectMapper mapper, Clock clock) {
        this.config = properties.replay();
        this.resources = resources;
        this.mapper = mapper;
        this.clock = clock;
    }

    @PostConstruct
    void load() {
        if (config.file() == null) {
            throw new IllegalStateException("arb.replay.file must be set when replay is enabled");
        }
        Resource resource = resources.getResource(config.file());
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    JsonNode frame = mapper.readTree(line);
                    if (!frame.isArray()) {
                        log.warn("[REPLAY] {}:{} is not a JSON array, skipped", config.file(), lineNo);
                        continue;
                    }
                    frames.add(frame);
                } catch (IOException e) {
                    log.warn("[REPLAY] {}:{} unreadable: {}", config.file(), lineNo, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read replay file " + config.file(), e);
        }
        log.info("[REPLAY] Loaded {} frames from {}", frames.size(), config.file());
    }

    @Override
    public String name() {
        return "replay";
    }

    @Override
    public void subscribe(Set<BookKey> books, Consumer<OrderBookSnapshot> sink) {
        this.wanted = Set.copyOf(books);
        this.sink = sink;
    }

    @Scheduled(fixedDelayString = "${arb.replay.interval-millis:1000}")
    public void tick() {
        emitNext();
    }

    /**
     * Emits the next frame.
     *
     * @return number of books delivered
     */
    synchronized int emitNext() {
        Consumer<OrderBookSnapshot> target = sink;
        if (target == null || frames.isEmpty()) {
            return 0;
        }
        if (cursor >= frames.size()) {
            if (!config.loop()) {
                return 0;
            }
            cursor = 0;
        }
        JsonNode frame = frames.get(cursor++);
        Instant now = clock.instant();
        int delivered = 0;
        for (JsonNode node : frame) {
            OrderBookSnapshot book;
            try {
                book = JsonBookParser.parse(node, now);
            } catch (IllegalArgumentException e) {
                log.warn("[REPLAY] frame {} has a bad book: {}", cursor, e.getMessage());
                continue;
            }
            if (wanted.contains(book.bookKey())) {
                target.accept(book);
                delivered++;
            }
        }
        return delivered;
    }

    public int frameCount() {
        return frames.size();
    }
}
