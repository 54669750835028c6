package com.example.place_service.service;

/**
 * Thrown when an indexed lookup falls outside the displayed places.
 */
public class PlaceNotFoundException extends RuntimeException {

    private final int index;

    public PlaceNotFoundException(int index) {
        super("There is no place at index: " + index);
        this.index = index;
    }

    public int getIndex() {
        return index;
    }
}
