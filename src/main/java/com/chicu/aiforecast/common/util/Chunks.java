package com.chicu.aiforecast.common.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * Запросы "where id in (...)" кусками по DEFAULT_SIZE id.
 */
public final class Chunks {

    public static final int DEFAULT_SIZE = 500;

    private Chunks() {
    }

    public static <T> List<T> query(Collection<String> ids, Function<List<String>, List<T>> query) {
        if (ids == null || ids.isEmpty()) return List.of();
        List<String> all = new ArrayList<>(ids);
        List<T> res = new ArrayList<>();
        for (int i = 0; i < all.size(); i += DEFAULT_SIZE) {
            res.addAll(query.apply(all.subList(i, Math.min(all.size(), i + DEFAULT_SIZE))));
        }
        return res;
    }
}
