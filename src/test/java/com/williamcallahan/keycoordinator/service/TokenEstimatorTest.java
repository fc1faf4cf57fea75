package com.williamcallahan.keycoordinator.service;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class TokenEstimatorTest {

    @Test
    void estimatesOneTokenPerFourCharactersRoundedUp() {
        assertEquals(0, TokenEstimator.estimate(null));
        assertEquals(0, TokenEstimator.estimate(""));
        assertEquals(1, TokenEstimator.estimate("abc"));
        assertEquals(1, TokenEstimator.estimate("abcd"));
        assertEquals(2, TokenEstimator.estimate("abcde"));
        assertEquals(250, TokenEstimator.estimate("x".repeat(1000)));
    }
}
