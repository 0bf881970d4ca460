package org.deepsymmetry.dantelink;

import org.junit.Test;

import static org.junit.Assert.*;

public class JmdnsBrowserTest {

    @Test
    public void resolveTimeoutIsConfigurable() {
        final JmdnsBrowser browser = new JmdnsBrowser();
        assertEquals(JmdnsBrowser.DEFAULT_RESOLVE_TIMEOUT, browser.getResolveTimeout());
        browser.setResolveTimeout(500);
        assertEquals(500, browser.getResolveTimeout());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNonPositiveTimeout() {
        new JmdnsBrowser().setResolveTimeout(-1);
    }

    @Test
    public void serviceRecordsDeriveMissingServerNames() {
        final ServiceRecord record = new ServiceRecord(Util.SERVICE_CHAN, "Out 1@desk._netaudio-chan._udp.local.",
                "10.0.0.1", 4455, "", null);
        assertEquals("Out 1@desk", record.getServerName());
        assertTrue(record.getProperties().isEmpty());
    }
}
