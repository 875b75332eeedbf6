package com.example.pairing.model;

public record ParticipantStatus(String username, boolean hasSubmitted) {}
