package com.venuearb.domain;

import lombok.Value;

@Value(staticConstructor = "of")
public class BookKey {
    String venue;
    Pair pair;

    @Override
    public String toString() {
        return pair + "@" + venue;
    }
}
