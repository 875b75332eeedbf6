package com.example.pairing.api;

public class ParticipantNotFoundException extends RuntimeException {
  public ParticipantNotFoundException(String sessionId, String username) {
    super("participant not found: " + username + " in session " + sessionId);
  }
}
