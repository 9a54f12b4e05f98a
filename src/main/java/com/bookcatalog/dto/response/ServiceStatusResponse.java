package com.bookcatalog.dto.response;

public record ServiceStatusResponse(String message, String status, String version) {}
