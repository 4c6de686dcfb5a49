package com.gnovoa.matchfeed.api.dto;

public record MatchViewersResponse(long matchId, int viewers) {}
