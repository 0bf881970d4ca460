package org.deepsymmetry.dantelink.aes67;

import org.junit.Test;

import static org.junit.Assert.*;

public class SapListenerTest {

    @Test
    public void listenWindowIsConfigurable() {
        final SapListener listener = new SapListener();
        assertEquals(SapListener.DEFAULT_LISTEN_WINDOW, listener.getListenWindow());
        listener.setListenWindow(250);
        assertEquals(250, listener.getListenWindow());
        assertTrue(listener.toString().contains("239.255.255.255:9875"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsEmptyWindow() {
        new SapListener().setListenWindow(0);
    }
}
