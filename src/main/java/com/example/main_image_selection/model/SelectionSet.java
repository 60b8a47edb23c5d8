package com.example.main_image_selection.model;

import com.example.main_image_selection.exception.StructuralViolationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Selections of one run keyed by hotel id. A hotel can appear at most once.
 */
public final class SelectionSet {
    private static final SelectionSet EMPTY = new SelectionSet(new TreeMap<>());

    private final Map<String, Selection> byHotel;

    private SelectionSet(TreeMap<String, Selection> byHotel) {
        this.byHotel = Collections.unmodifiableMap(byHotel);
    }

    public static SelectionSet empty() {
        return EMPTY;
    }

    /**
     * Builds a set from selections.
     *
     * @throws StructuralViolationException when two selections share a hotel id.
     */
    public static SelectionSet of(Collection<Selection> selections) {
        TreeMap<String, Selection> map = new TreeMap<>();
        for (Selection selection : selections) {
            Selection previous = map.putIfAbsent(selection.hotelId(), selection);
            if (previous != null) {
                throw new StructuralViolationException("Duplicate selection for hotel " + selection.hotelId()
                        + " images=" + previous.imageId() + "," + selection.imageId());
            }
        }
        return new SelectionSet(map);
    }

    public Optional<Selection> get(String hotelId) {
        return Optional.ofNullable(byHotel.get(hotelId));
    }

    public boolean contains(String hotelId) {
        return byHotel.containsKey(hotelId);
    }

    public Set<String> hotelIds() {
        return byHotel.keySet();
    }

    /** Selections ordered by hotel id. */
    public List<Selection> asList() {
        return new ArrayList<>(byHotel.values());
    }

    public int size() {
        return byHotel.size();
    }

    public boolean isEmpty() {
        return byHotel.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SelectionSet that)) return false;
        return byHotel.equals(that.byHotel);
    }

    @Override
    public int hashCode() {
        return byHotel.hashCode();
    }

    @Override
    public String toString() {
        return "SelectionSet" + byHotel.values();
    }
}
