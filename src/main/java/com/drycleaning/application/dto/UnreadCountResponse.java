package com.drycleaning.application.dto;

public record UnreadCountResponse(long unreadCount) {}
