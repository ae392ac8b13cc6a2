package com.mockinterview.platform.controller;

import lombok.Value;

import java.time.Instant;

@Value
public class ApiError {
    String error;
    String subsystem;
    String message;
    Instant timestamp;
}
