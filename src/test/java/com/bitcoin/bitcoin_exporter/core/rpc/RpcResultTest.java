package com.bitcoin.bitcoin_exporter.core.rpc;

import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class RpcResultTest {

    @Test
    void successCarriesValue() {
        RpcResult<String> result = RpcResult.success("ok");

        assertTrue(result.isSuccess());
        assertEquals("ok", result.getValue());
        assertEquals(2, result.map(String::length).getValue());
        assertThrows(IllegalStateException.class, result::getFailureReason);
    }

    @Test
    void failureCarriesReason() {
        RpcResult<String> result = RpcResult.failure("timed out");

        assertTrue(result.isFailure());
        assertEquals("timed out", result.getFailureReason());
        assertEquals("fallback", result.orElse("fallback"));
        assertEquals("timed out", result.map(String::length).getFailureReason());
        assertThrows(NoSuchElementException.class, result::getValue);
    }

    @Test
    void successRejectsNull() {
        assertThrows(NullPointerException.class, () -> RpcResult.success(null));
    }
}
