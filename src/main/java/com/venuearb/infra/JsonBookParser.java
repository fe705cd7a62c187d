package com.venuearb.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.venuearb.domain.OrderBookSnapshot;
import com.venuearb.domain.OrderLevel;
import com.venuearb.domain.Pair;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads books shaped like {@code {"venue":..,"pair":"SOL/USDT","bids":[{"price":..,"size":..}],"asks":[..]}}.
 */
public final class JsonBookParser {

    private JsonBookParser() {
    }

    /**
     * @throws IllegalArgumentException if venue or pair is missing or a level is not a number
     */
    public static OrderBookSnapshot parse(JsonNode node, Instant observedAt) {
        if (!node.hasNonNull("venue") || !node.hasNonNull("pair")) {
            throw new IllegalArgumentException("Book needs venue and pair: " + node);
        }
        return OrderBookSnapshot.builder()
                .venue(node.get("venue").asText())
                .pair(Pair.parse(node.get("pair").asText()))
                .bids(parseLevels(node.path("bids")))
                .asks(parseLevels(node.path("asks")))
                .observedAt(observedAt)
                .build();
    }

    static List<OrderLevel> parseLevels(JsonNode levelsNode) {
        List<OrderLevel> list = new ArrayList<>();
        if (levelsNode.isArray()) {
            for (JsonNode l : levelsNode) {
                BigDecimal price = new BigDecimal(l.path("price").asText("0"));
                BigDecimal size = new BigDecimal(l.path("size").asText("0"));
                // empty levels carry no liquidity
                if (price.signum() > 0 && size.signum() > 0) {
                    list.add(OrderLevel.builder().price(price).size(size).build());
                }
            }
        }
        return list;
    }
}
