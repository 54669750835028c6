package com.example.place_service.service;

@FunctionalInterface
public interface ListenerRegistration {

    /**
     * Detaches the listener. Has no effect if another listener has replaced it since.
     */
    void unregister();
}
