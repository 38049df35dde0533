package com.perpclear.clearing.position;

public record PositionKey(String account, String marketId) {}
