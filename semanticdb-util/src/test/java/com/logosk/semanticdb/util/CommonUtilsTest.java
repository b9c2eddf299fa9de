package com.logosk.semanticdb.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class CommonUtilsTest {

    @Test
    void shortIdKeepsPrefixAndLength() {
        String id = CommonUtils.shortId("HW_", 12);
        assertTrue(id.startsWith("HW_"));
        assertEquals(15, id.length());
        assertTrue(id.substring(3).matches("[0-9a-f]{12}"));
        assertNotEquals(id, CommonUtils.shortId("HW_", 12));
    }

    @Test
    void shortIdRejectsBadLength() {
        assertThrows(IllegalArgumentException.class, () -> CommonUtils.shortId("x", 0));
        assertThrows(IllegalArgumentException.class, () -> CommonUtils.shortId("x", 33));
    }

    @Test
    void sha3DigestIsStable() {
        String a = CommonUtils.digestHex("SHA3-256", "logos");
        String b = CommonUtils.digestHex("SHA3-256", "logos");
        assertEquals(a, b);
        assertEquals(64, a.length());
        assertNotEquals(a, CommonUtils.digestHex("SHA3-256", "logos!"));
    }

    @Test
    void unknownAlgorithmIsReported() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> CommonUtils.digestHex("NOPE-1", "x"));
        assertTrue(ex.getMessage().contains("NOPE-1"));
    }

    @Test
    void clampStaysInUnitInterval() {
        assertEquals(0.0, CommonUtils.clamp01(-0.3));
        assertEquals(1.0, CommonUtils.clamp01(1.7));
        assertEquals(0.42, CommonUtils.clamp01(0.42));
    }

    @Test
    void canonicalJsonIgnoresInsertionOrder() throws Exception {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("b", 2);
        first.put("a", 1);
        Map<String, Object> second = new TreeMap<>(first);

        assertEquals(JsonUtils.instance().toCanonicalJson(first), JsonUtils.instance().toCanonicalJson(second));
        assertEquals("{\"a\":1,\"b\":2}", JsonUtils.instance().toCanonicalJson(first));
    }
}
