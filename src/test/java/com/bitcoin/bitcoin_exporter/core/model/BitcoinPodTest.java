package com.bitcoin.bitcoin_exporter.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BitcoinPodTest {

    @Test
    void derivesShortNameFromFirstLabel() {
        BitcoinPod pod = BitcoinPod.forOrdinal(2, "bitcoin-stack", "bitcoin", "svc.cluster.local");

        assertEquals("bitcoin-stack-2.bitcoin-stack.bitcoin.svc.cluster.local", pod.getHost());
        assertEquals("bitcoin-stack-2", pod.getName());
        assertEquals(2, pod.getOrdinal());
    }

    @Test
    void shortNameOfUnqualifiedHostIsTheHost() {
        assertEquals("localhost", new BitcoinPod(0, "localhost").getName());
    }

    @Test
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new BitcoinPod(-1, "host"));
        assertThrows(IllegalArgumentException.class, () -> new BitcoinPod(0, " "));
        assertThrows(IllegalArgumentException.class, () -> new BitcoinPod(0, null));
    }

    @Test
    void equalityUsesOrdinalAndHost() {
        assertEquals(new BitcoinPod(1, "a.b"), new BitcoinPod(1, "a.b"));
        assertNotEquals(new BitcoinPod(1, "a.b"), new BitcoinPod(2, "a.b"));
    }
}
