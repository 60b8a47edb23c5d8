package com.example.main_image_selection.selector;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Partial ranking of a subset of the candidates, keyed by hotel id.
 */
public final class HotelRanking {
    private final Map<String, HotelCandidates> byHotel;

    HotelRanking(Map<String, HotelCandidates> byHotel) {
        this.byHotel = Collections.unmodifiableMap(new TreeMap<>(byHotel));
    }

    public static HotelRanking empty() {
        return new HotelRanking(Map.of());
    }

    public Map<String, HotelCandidates> byHotel() {
        return byHotel;
    }

    public int hotelCount() {
        return byHotel.size();
    }

    HotelRanking merge(HotelRanking other, TieBreakChain chain) {
        Map<String, HotelCandidates> merged = new TreeMap<>(byHotel);
        other.byHotel.forEach((hotelId, candidates) -> merged.merge(hotelId, candidates, (a, b) -> a.combine(b, chain)));
        return new HotelRanking(merged);
    }
}
