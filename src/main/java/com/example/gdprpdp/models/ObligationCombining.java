package com.example.gdprpdp.models;

/**
 * How retention obligations from several equally specific Permit rules are merged.
 * {@link #UNION} keeps every distinct (target, period) pair; {@link #MOST_RESTRICTIVE}
 * keeps only the shortest period per data target and must be chosen explicitly by the policy author.
 */
public enum ObligationCombining {
    UNION,
    MOST_RESTRICTIVE
}
