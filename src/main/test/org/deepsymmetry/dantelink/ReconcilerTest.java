package org.deepsymmetry.dantelink;

import org.deepsymmetry.dantelink.aes67.SapPacket;
import org.deepsymmetry.dantelink.aes67.StreamCache;
import org.deepsymmetry.dantelink.aes67.StreamInfo;
import org.deepsymmetry.dantelink.control.DeviceControls;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ReconcilerTest {

    private static final String STUDIO_A_SDP = "v=0\n" +
            "o=- 1311738121 1311738121 IN IP4 192.168.1.20\n" +
            "s=Studio A\n" +
            "i=2 channels: Tx Left, Tx Right\n" +
            "c=IN IP4 239.69.85.220/32\n" +
            "m=audio 5004 RTP/AVP 97\n" +
            "a=rtpmap:97 L24/48000/2\n";

    private final Reconciler reconciler = new Reconciler();
    private StreamCache streams;
    private SourceSelections selections;

    @Before
    public void setUp() {
        streams = new StreamCache();
        streams.put(SapPacket.parseSdp(STUDIO_A_SDP));
        selections = new SourceSelections();
    }

    private static DanteDevice receiver(Subscription... subscriptions) {
        final DanteDevice device = new DanteDevice("amp");
        device.applyControls(new DeviceControls("Amp", "Audinate", "DAO2", null,
                Map.of(1, new Channel(1, "In A"), 2, new Channel(2, "In B")),
                Map.of(), List.of(subscriptions)));
        return device;
    }

    @Test
    public void recoversSelectionFromMulticastAddressAndChannelIndex() {
        final DanteDevice amp = receiver(new Subscription("In B", "2", "239.69.85.220", 9));
        assertEquals(1, reconciler.reconcile(Map.of("Amp", amp), streams, selections));
        assertEquals("[AES67] Studio A - Tx Right", selections.get(new SelectionKey("Amp", 2)));
    }

    @Test
    public void recoversSelectionFromOriginAndChannelName() {
        final DanteDevice amp = receiver(new Subscription("In A", "Tx Left", "192.168.1.20", null));
        assertEquals(1, reconciler.reconcile(Map.of("Amp", amp), streams, selections));
        assertEquals("[AES67] Studio A - Tx Left", selections.get(new SelectionKey("Amp", 1)));
    }

    @Test
    public void fallsBackToFirstChannel() {
        final DanteDevice amp = receiver(new Subscription("In A", "17", "239.69.85.220", null),
                new Subscription("In B", "mystery", "239.69.85.220", null));
        assertEquals(2, reconciler.reconcile(Map.of("Amp", amp), streams, selections));
        assertEquals("[AES67] Studio A - Tx Left", selections.get(new SelectionKey("Amp", 1)));
        assertEquals("[AES67] Studio A - Tx Left", selections.get(new SelectionKey("Amp", 2)));
    }

    @Test
    public void neverOverwritesExistingSelection() {
        final SelectionKey key = new SelectionKey("Amp", 2);
        selections.set(key, "[AES67] Other - Left");
        final DanteDevice amp = receiver(new Subscription("In B", "2", "239.69.85.220", null));
        assertEquals(0, reconciler.reconcile(Map.of("Amp", amp), streams, selections));
        assertEquals("[AES67] Other - Left", selections.get(key));
    }

    @Test
    public void skipsDanteSubscriptions() {
        final DanteDevice amp = receiver(new Subscription("In A", "Out 1", "console", 9));
        assertEquals(0, reconciler.reconcile(Map.of("Amp", amp), streams, selections));
        assertEquals(0, selections.size());
    }

    @Test
    public void skipsUnknownReceiveChannel() {
        final DanteDevice amp = receiver(new Subscription("In Z", "1", "239.69.85.220", null));
        assertEquals(0, reconciler.reconcile(Map.of("Amp", amp), streams, selections));
        assertTrue(selections.snapshot().isEmpty());
    }

    @Test
    public void doesNothingWithoutStreams() {
        final DanteDevice amp = receiver(new Subscription("In A", "1", "239.69.85.220", null));
        assertEquals(0, reconciler.reconcile(Map.of("Amp", amp), new StreamCache(), selections));
        assertEquals(0, selections.size());
    }

    @Test
    public void labelsUseStreamAndChannel() {
        assertEquals("[AES67] Studio A - Tx Left", Reconciler.aes67Label("Studio A", "Tx Left"));
        final StreamInfo stream = streams.get("Studio A");
        assertEquals("Tx Right", Reconciler.channelLabel(stream.getChannelNames(), " 2 "));
        assertEquals("Tx Left", Reconciler.channelLabel(stream.getChannelNames(), null));
        assertEquals("Tx Left", Reconciler.channelLabel(stream.getChannelNames(), "0"));
    }
}
