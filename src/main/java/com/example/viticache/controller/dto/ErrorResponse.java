package com.example.viticache.controller.dto;

import lombok.Value;

import java.util.Map;

@Value
public class ErrorResponse {

    String error;
    String endpoint;
    Map<String, String> providedParams;
    String status;
}
