package com.drycleaning.application.dto;

public record MarkAllReadResponse(int updatedCount) {}
