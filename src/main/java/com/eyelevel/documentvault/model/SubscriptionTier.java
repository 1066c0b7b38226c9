package com.eyelevel.documentvault.model;

public enum SubscriptionTier {
    FREE,
    PREMIUM
}
