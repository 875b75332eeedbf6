package com.example.pairing.api;

public class InvalidCredentialsException extends RuntimeException {
  public InvalidCredentialsException() {
    super("invalid credentials");
  }
}
