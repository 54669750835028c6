package com.example.place_service.model;

public enum TransitMode {
    WALKING,
    DRIVING
}
