package com.perpclear.core.access;

public enum Role {
    ADMIN,          // reserve resets, pricing parameters, swap pause, role grants
    RISK_MANAGER    // per-market risk parameters
}
