package com.fellowship.auth.twofactor;

public enum ChallengeStatus {
    UNVERIFIED,
    VERIFIED
}
