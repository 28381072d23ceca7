package me.golemcore.quota.domain.service;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntegrityFaultLogTest {

    private final IntegrityFaultLog faultLog = new IntegrityFaultLog();

    @Test
    void recordsFirstFaultOnce() {
        assertTrue(faultLog.recordUnknownTier("alice", "bogus"));
        assertFalse(faultLog.recordUnknownTier("alice", "bogus"));
        assertEquals(1, faultLog.size());
    }

    @Test
    void snapshotIsOrderedAndDetached() {
        faultLog.recordUnknownTier("zed", "free");
        faultLog.recordUnknownTier("amy", null);

        Map<String, String> snapshot = faultLog.snapshot();
        faultLog.clear("zed");

        assertEquals("amy", snapshot.keySet().iterator().next());
        assertEquals("<null>", snapshot.get("amy"));
        assertEquals(2, snapshot.size());
        assertEquals(1, faultLog.size());
    }
}
