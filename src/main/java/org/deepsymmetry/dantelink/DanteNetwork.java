package org.deepsymmetry.dantelink;

import org.apiguardian.api.API;
import org.deepsymmetry.dantelink.aes67.CommandSender;
import org.deepsymmetry.dantelink.aes67.SapListener;
import org.deepsymmetry.dantelink.aes67.StreamCache;
import org.deepsymmetry.dantelink.aes67.StreamDiscovery;
import org.deepsymmetry.dantelink.aes67.StreamInfo;
import org.deepsymmetry.dantelink.aes67.SubscribeCommand;
import org.deepsymmetry.dantelink.aes67.SubscribeResult;
import org.deepsymmetry.dantelink.aes67.UdpCommandSender;
import org.deepsymmetry.dantelink.control.DeviceControl;
import org.deepsymmetry.dantelink.control.DeviceControlFactory;
import org.deepsymmetry.dantelink.control.DeviceSettings;
import org.deepsymmetry.dantelink.control.GainDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * <p>Keeps track of the Dante devices and AES67 streams on the network, and lets callers route audio between
 * them.</p>
 *
 * <p>Each refresh pass browses for the Dante mDNS services, consolidates them into devices, asks each device for
 * its channels and subscriptions over its control channel, listens for SAP announcements of AES67 streams, and
 * recovers the AES67 source selections that devices remember across restarts. The result is published as an
 * immutable snapshot, and {@link SnapshotListener}s are told about it. A pass which cannot browse at all fails as
 * a whole and leaves the previous snapshot in place; any other problem only costs the device or stream involved.</p>
 *
 * <p>The stream cache, source selections and device registry belong to this object and live as long as it does.
 * Once {@link #start()} has been called, passes run periodically on a single scheduler thread, so they never
 * overlap. Socket work that blocks (control queries, SAP listening and AES67 command exchanges) runs on a separate
 * pool of threads.</p>
 */
@API(status = API.Status.STABLE)
public class DanteNetwork extends LifecycleParticipant {

    private static final Logger logger = LoggerFactory.getLogger(DanteNetwork.class);

    /**
     * The option which means a receive channel should have no source at all.
     */
    @API(status = API.Status.STABLE)
    public static final String SUBSCRIPTION_NONE = "None";

    /**
     * The default number of milliseconds between the starts of refresh passes.
     */
    @API(status = API.Status.STABLE)
    public static final long DEFAULT_REFRESH_INTERVAL = 30000;

    /**
     * The default number of milliseconds spent browsing for mDNS services in each pass.
     */
    @API(status = API.Status.STABLE)
    public static final long DEFAULT_BROWSE_WINDOW = 5000;

    /**
     * The default number of consecutive passes a device can go unseen before we forget about it.
     */
    @API(status = API.Status.STABLE)
    public static final int DEFAULT_DEVICE_MISS_LIMIT = 10;

    /**
     * Identifies a channel of an AES67 stream chosen as a source.
     */
    @API(status = API.Status.STABLE)
    public static class Aes67Source {

        /**
         * The name of the stream.
         */
        @API(status = API.Status.STABLE)
        public final String sessionName;

        /**
         * The stream itself, as last announced.
         */
        @API(status = API.Status.STABLE)
        public final StreamInfo stream;

        /**
         * The name of the chosen channel within the stream.
         */
        @API(status = API.Status.STABLE)
        public final String channelName;

        /**
         * The 1-based position of the chosen channel within the stream.
         */
        @API(status = API.Status.STABLE)
        public final int flowChannel;

        Aes67Source(String sessionName, StreamInfo stream, String channelName, int flowChannel) {
            this.sessionName = sessionName;
            this.stream = stream;
            this.channelName = channelName;
            this.flowChannel = flowChannel;
        }

        /**
         * Get the label which identifies this source in selection lists.
         *
         * @return the label, of the form {@code [AES67] Stream - Channel}
         */
        @API(status = API.Status.STABLE)
        public String getLabel() {
            return Reconciler.aes67Label(sessionName, channelName);
        }

        @Override
        public String toString() {
            return "Aes67Source[stream:" + sessionName + ", channel:" + channelName + ", flow:" + flowChannel + "]";
        }
    }

    private final MdnsBrowser browser;
    private final StreamDiscovery streamDiscovery;
    private final CommandSender commandSender;
    private final DeviceControlFactory controlFactory;
    private final DeviceConsolidator consolidator = new DeviceConsolidator();
    private final Reconciler reconciler = new Reconciler();

    private final StreamCache streamCache = new StreamCache();
    private final SourceSelections selections = new SourceSelections();

    /**
     * The most recently published devices, keyed by display name.
     */
    private final AtomicReference<Map<String, DanteDevice>> snapshot = new AtomicReference<>(Collections.emptyMap());

    /**
     * Devices we have seen recently, keyed by display name. Unlike the snapshot, a device stays here for a while
     * after it stops being found, so that a single missed announcement does not make it unreachable.
     */
    private final Map<String, DanteDevice> registry = new ConcurrentHashMap<>();

    /**
     * How many consecutive passes each device in the registry has been missing from.
     */
    private final Map<String, Integer> missedPasses = new HashMap<>();

    private final AtomicLong refreshInterval = new AtomicLong(DEFAULT_REFRESH_INTERVAL);
    private final AtomicLong browseWindow = new AtomicLong(DEFAULT_BROWSE_WINDOW);
    private final AtomicInteger deviceMissLimit = new AtomicInteger(DEFAULT_DEVICE_MISS_LIMIT);

    /**
     * Runs the socket work that blocks, so that the refresh thread only ever waits for results.
     */
    private final ExecutorService blockingExecutor = Executors.newCachedThreadPool(daemonThreads("dante-link blocking"));

    /**
     * Runs the periodic refresh passes while we are started.
     */
    private final AtomicReference<ScheduledExecutorService> scheduler = new AtomicReference<>();

    /**
     * Held for the duration of a refresh pass, so that a pass requested by hand cannot overlap a scheduled one.
     */
    private final Object refreshLock = new Object();

    private final Set<SnapshotListener> snapshotListeners = Collections.newSetFromMap(new ConcurrentHashMap<>());

    /**
     * Create an instance which talks to the real network.
     *
     * @param controlFactory creates the handles used to talk to each device's control channel
     */
    @API(status = API.Status.STABLE)
    public DanteNetwork(DeviceControlFactory controlFactory) {
        this(new JmdnsBrowser(), new SapListener(), new UdpCommandSender(), controlFactory);
    }

    /**
     * Create an instance with explicit collaborators for each kind of network access.
     *
     * @param browser finds the mDNS services advertised by Dante devices
     * @param streamDiscovery listens for AES67 stream announcements
     * @param commandSender exchanges AES67 subscribe commands with devices
     * @param controlFactory creates the handles used to talk to each device's control channel
     */
    @API(status = API.Status.STABLE)
    public DanteNetwork(MdnsBrowser browser, StreamDiscovery streamDiscovery, CommandSender commandSender,
                        DeviceControlFactory controlFactory) {
        if (browser == null || streamDiscovery == null || commandSender == null || controlFactory == null) {
            throw new IllegalArgumentException("All collaborators must be supplied");
        }
        this.browser = browser;
        this.streamDiscovery = streamDiscovery;
        this.commandSender = commandSender;
        this.controlFactory = controlFactory;
    }

    /**
     * Build a thread factory which creates numbered daemon threads.
     *
     * @param prefix the start of each thread name
     *
     * @return the factory
     */
    private static ThreadFactory daemonThreads(final String prefix) {
        final AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            final Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Set how often refresh passes start once we are running. Takes effect the next time we are started.
     *
     * @param milliseconds the interval between the starts of refresh passes
     */
    @API(status = API.Status.STABLE)
    public void setRefreshInterval(long milliseconds) {
        if (milliseconds < 1) {
            throw new IllegalArgumentException("Refresh interval must be positive");
        }
        refreshInterval.set(milliseconds);
    }

    /**
     * Check how often refresh passes start once we are running.
     *
     * @return the interval between the starts of refresh passes, in milliseconds
     */
    @API(status = API.Status.STABLE)
    public long getRefreshInterval() {
        return refreshInterval.get();
    }

    /**
     * Set how long each pass browses for mDNS services.
     *
     * @param milliseconds the length of the browse window
     */
    @API(status = API.Status.STABLE)
    public void setBrowseWindow(long milliseconds) {
        if (milliseconds < 0) {
            throw new IllegalArgumentException("Browse window cannot be negative");
        }
        browseWindow.set(milliseconds);
    }

    /**
     * Check how long each pass browses for mDNS services.
     *
     * @return the length of the browse window, in milliseconds
     */
    @API(status = API.Status.STABLE)
    public long getBrowseWindow() {
        return browseWindow.get();
    }

    /**
     * Set how many consecutive passes a device can be missing from before {@link #getDevice(String)} stops
     * finding it.
     *
     * @param passes the number of passes
     */
    @API(status = API.Status.STABLE)
    public void setDeviceMissLimit(int passes) {
        if (passes < 1) {
            throw new IllegalArgumentException("Device miss limit must be at least 1");
        }
        deviceMissLimit.set(passes);
    }

    /**
     * Check how many consecutive passes a device can be missing from before we forget about it.
     *
     * @return the number of passes
     */
    @API(status = API.Status.STABLE)
    public int getDeviceMissLimit() {
        return deviceMissLimit.get();
    }

    /**
     * Adds the specified listener to be told about each published snapshot. If {@code listener} is {@code null}
     * or already registered, no exception is thrown and no action is performed.
     *
     * @param listener the snapshot listener to add
     */
    @API(status = API.Status.STABLE)
    public void addSnapshotListener(SnapshotListener listener) {
        if (listener != null) {
            snapshotListeners.add(listener);
        }
    }

    /**
     * Removes the specified snapshot listener. If {@code listener} is {@code null} or not registered, no exception
     * is thrown and no action is performed.
     *
     * @param listener the snapshot listener to remove
     */
    @API(status = API.Status.STABLE)
    public void removeSnapshotListener(SnapshotListener listener) {
        if (listener != null) {
            snapshotListeners.remove(listener);
        }
    }

    /**
     * Get the set of snapshot listeners that are currently registered.
     *
     * @return an immutable snapshot of the registered listeners
     */
    @API(status = API.Status.STABLE)
    public Set<SnapshotListener> getSnapshotListeners() {
        return Set.copyOf(snapshotListeners);
    }

    /**
     * Run a complete refresh pass and publish its result. Blocks for at least the browse window, plus the SAP
     * listening window if any devices were found.
     *
     * @return the devices found, keyed by display name
     *
     * @throws IOException if browsing for devices was impossible, in which case the previous snapshot stays
     *                     published
     */
    @API(status = API.Status.STABLE)
    public Map<String, DanteDevice> refresh() throws IOException {
        synchronized (refreshLock) {
            final List<ServiceRecord> records = browser.browse(Util.SERVICES, browseWindow.get());
            final Map<String, DanteDevice> byHost = consolidator.consolidate(records);
            collectControls(byHost.values());

            final Map<String, DanteDevice> devices = new LinkedHashMap<>();
            for (DanteDevice device : byHost.values()) {
                final DanteDevice previous = devices.put(device.getName(), device);
                if (previous != null) {
                    logger.warn("Devices on hosts {} and {} both call themselves {}, keeping the latter",
                            previous.getServerName(), device.getServerName(), device.getName());
                }
            }

            discoverStreams(devices.values());
            reconciler.reconcile(devices, streamCache, selections);

            final Map<String, DanteDevice> published = Collections.unmodifiableMap(devices);
            snapshot.set(published);
            updateRegistry(published);
            logger.info("Refresh found {} device(s) from {} service record(s), {} AES67 stream(s) known",
                    published.size(), records.size(), streamCache.size());
            deliverSnapshot(published);
            return published;
        }
    }

    /**
     * Ask every device for its controls, in parallel. A device which cannot be queried keeps just what it
     * advertised over mDNS.
     *
     * @param devices the devices found by the current pass
     *
     * @throws InterruptedIOException if we are interrupted while waiting for the queries
     */
    private void collectControls(Collection<DanteDevice> devices) throws InterruptedIOException {
        final List<Future<?>> queries = new ArrayList<>(devices.size());
        for (final DanteDevice device : devices) {
            queries.add(blockingExecutor.submit(() -> queryControls(device)));
        }
        for (Future<?> query : queries) {
            try {
                query.get();
            } catch (ExecutionException e) {
                logger.warn("Unexpected failure querying device controls", e.getCause());
            } catch (InterruptedException e) {
                for (Future<?> pending : queries) {
                    pending.cancel(true);
                }
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while querying device controls");
            }
        }
    }

    /**
     * Open a control handle for a device, then fold what it reports into the device.
     *
     * @param device the device to query
     */
    private void queryControls(DanteDevice device) {
        try {
            final DeviceControl control = controlFactory.open(device);
            device.setControl(control);
            device.applyControls(control.getControls());
        } catch (Exception e) {
            logger.warn("Failed to get controls for {}", device.getName(), e);
        }
    }

    /**
     * Listen for AES67 stream announcements on the interface facing the devices, and add what we hear to the
     * stream cache. Failures are logged and leave the cache as it was.
     *
     * @param devices the devices found by the current pass
     *
     * @throws InterruptedIOException if we are interrupted while waiting for the listening window to close
     */
    private void discoverStreams(Collection<DanteDevice> devices) throws InterruptedIOException {
        final List<String> addresses = new ArrayList<>();
        for (DanteDevice device : devices) {
            addresses.add(device.getIpv4());
        }
        final InetAddress bindAddress = Util.findBindAddress(addresses);
        if (bindAddress == null) {
            logger.info("No Dante device addresses found, skipping SAP discovery");
            return;
        }
        logger.debug("Listening for SAP announcements on {}", bindAddress.getHostAddress());
        final Future<Map<String, StreamInfo>> discovery = blockingExecutor.submit(() -> streamDiscovery.discover(bindAddress));
        try {
            final Map<String, StreamInfo> found = discovery.get();
            final int added = streamCache.merge(found);
            logger.info("SAP: heard {} stream(s), {} new, {} total", found.size(), added, streamCache.size());
        } catch (ExecutionException e) {
            logger.warn("SAP discovery failed", e.getCause());
        } catch (InterruptedException e) {
            discovery.cancel(true);
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while listening for SAP announcements");
        }
    }

    /**
     * Record the devices seen in the latest pass, and forget those that have been missing for too long.
     *
     * @param devices the devices just published
     */
    private void updateRegistry(Map<String, DanteDevice> devices) {
        registry.putAll(devices);
        for (String name : devices.keySet()) {
            missedPasses.remove(name);
        }
        for (String name : new ArrayList<>(registry.keySet())) {
            if (!devices.containsKey(name)) {
                final int misses = missedPasses.merge(name, 1, Integer::sum);
                if (misses >= deviceMissLimit.get()) {
                    registry.remove(name);
                    missedPasses.remove(name);
                    logger.info("Forgetting device {} after {} passes without seeing it", name, misses);
                }
            }
        }
    }

    /**
     * Tell the registered listeners about a newly published snapshot.
     *
     * @param devices the snapshot
     */
    private void deliverSnapshot(Map<String, DanteDevice> devices) {
        for (SnapshotListener listener : getSnapshotListeners()) {
            try {
                listener.snapshotUpdated(devices);
            } catch (Throwable t) {
                logger.warn("Problem delivering snapshot to listener", t);
            }
        }
    }

    /**
     * Run a refresh pass on behalf of the scheduler, which must never see an exception or it stops scheduling.
     */
    private void scheduledRefresh() {
        try {
            refresh();
        } catch (IOException e) {
            logger.warn("Refresh pass failed, previous snapshot remains published", e);
        } catch (Throwable t) {
            logger.error("Unexpected problem during refresh pass", t);
        }
    }

    /**
     * Start running refresh passes periodically, beginning immediately. Does nothing if we are already running.
     */
    @API(status = API.Status.STABLE)
    public synchronized void start() {
        if (!isRunning()) {
            final ScheduledExecutorService refresher =
                    Executors.newSingleThreadScheduledExecutor(daemonThreads("dante-link refresh"));
            refresher.scheduleAtFixedRate(this::scheduledRefresh, 0, refreshInterval.get(), TimeUnit.MILLISECONDS);
            scheduler.set(refresher);
            logger.info("Started, refreshing every {} ms", refreshInterval.get());
            deliverLifecycleAnnouncement(logger, true);
        }
    }

    /**
     * Stop running refresh passes. A pass already under way is allowed to finish. The published snapshot, stream
     * cache and source selections are kept.
     */
    @API(status = API.Status.STABLE)
    public synchronized void stop() {
        final ScheduledExecutorService refresher = scheduler.getAndSet(null);
        if (refresher != null) {
            refresher.shutdown();
            logger.info("Stopped");
            deliverLifecycleAnnouncement(logger, false);
        }
    }

    @Override
    public boolean isRunning() {
        return scheduler.get() != null;
    }

    /**
     * Get the devices found by the most recent successful pass.
     *
     * @return the devices, keyed by display name; empty before the first pass
     */
    @API(status = API.Status.STABLE)
    public Map<String, DanteDevice> getDevices() {
        return snapshot.get();
    }

    /**
     * Look up a device by display name. Devices stay available here for a few passes after they were last seen.
     *
     * @param name the display name of the device
     *
     * @return the device, or {@code null} if we do not know of one by that name
     */
    @API(status = API.Status.STABLE)
    public DanteDevice getDevice(String name) {
        return (name == null)? null : registry.get(name);
    }

    /**
     * Get the streams heard so far.
     *
     * @return the stream cache, which outlives individual passes
     */
    @API(status = API.Status.STABLE)
    public StreamCache getStreamCache() {
        return streamCache;
    }

    /**
     * Get the AES67 source selections recorded for device receive channels.
     *
     * @return the selections
     */
    @API(status = API.Status.STABLE)
    public SourceSelections getSelections() {
        return selections;
    }

    /**
     * List every transmit channel in the latest snapshot as a possible source.
     *
     * @return labels of the form {@code Device - Channel}, sorted
     */
    @API(status = API.Status.STABLE)
    public List<String> getAllTxChannels() {
        final List<String> result = new ArrayList<>();
        for (Map.Entry<String, DanteDevice> entry : getDevices().entrySet()) {
            for (Channel channel : entry.getValue().getTxChannels().values()) {
                result.add(entry.getKey() + Reconciler.LABEL_SEPARATOR + channel.name);
            }
        }
        Collections.sort(result);
        return Collections.unmodifiableList(result);
    }

    /**
     * List every channel of every AES67 stream heard so far as a possible source.
     *
     * @return labels of the form {@code [AES67] Stream - Channel}, grouped by stream in name order, with each
     *         stream's channels in channel order
     */
    @API(status = API.Status.STABLE)
    public List<String> getAllAes67Sources() {
        final List<String> result = new ArrayList<>();
        for (Map.Entry<String, StreamInfo> entry : streamCache.getStreams().entrySet()) {
            for (String channelName : entry.getValue().getChannelNames()) {
                result.add(Reconciler.aes67Label(entry.getKey(), channelName));
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Interpret an AES67 source label.
     *
     * @param option a label of the form {@code [AES67] Stream - Channel}; stream names may themselves contain
     *               the separator, so the channel is taken from after the last one
     *
     * @return the stream and channel it names, or {@code null} if it is not an AES67 label or names a stream or
     *         channel we do not know
     */
    @API(status = API.Status.STABLE)
    public Aes67Source findAes67Source(String option) {
        if (option == null || !option.startsWith(Reconciler.AES67_PREFIX)) {
            return null;
        }
        final String rest = option.substring(Reconciler.AES67_PREFIX.length());
        final int separator = rest.lastIndexOf(Reconciler.LABEL_SEPARATOR);
        if (separator < 0) {
            return null;
        }
        final String sessionName = rest.substring(0, separator);
        final String channelName = rest.substring(separator + Reconciler.LABEL_SEPARATOR.length());
        final StreamInfo stream = streamCache.get(sessionName);
        if (stream == null) {
            return null;
        }
        final int index = stream.getChannelNames().indexOf(channelName);
        if (index < 0) {
            return null;
        }
        return new Aes67Source(sessionName, stream, channelName, index + 1);
    }

    /**
     * Subscribe a device receive channel to a channel of an AES67 stream, and remember the choice if the device
     * accepts it. The command exchange runs on the blocking pool; this call waits for it.
     *
     * @param deviceName the display name of the receiving device
     * @param rxChannel the receive channel number
     * @param option the AES67 source label, as listed by {@link #getAllAes67Sources()}
     *
     * @return the outcome of the exchange with the device
     *
     * @throws IllegalArgumentException if the device, channel or stream is unknown, or the device or stream lacks
     *                                  an address we need
     */
    @API(status = API.Status.EXPERIMENTAL)
    public SubscribeResult subscribeAes67(String deviceName, int rxChannel, String option) {
        final DanteDevice device = getDevice(deviceName);
        if (device == null) {
            throw new IllegalArgumentException("Device not found: " + deviceName);
        }
        if (!device.getRxChannels().containsKey(rxChannel)) {
            throw new IllegalArgumentException("RX channel " + rxChannel + " not found on " + deviceName);
        }
        final Aes67Source source = findAes67Source(option);
        if (source == null) {
            throw new IllegalArgumentException("AES67 stream not found for option: " + option);
        }
        if (device.getIpv4() == null || device.getIpv4().isEmpty()) {
            throw new IllegalArgumentException("No IP address for device " + deviceName);
        }

        final int sequence = ThreadLocalRandom.current().nextInt(0x10000);
        final byte[] frame = SubscribeCommand.encode(rxChannel, source.flowChannel, source.stream, sequence);
        final InetAddress address;
        try {
            address = InetAddress.getByName(device.getIpv4());
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Invalid IP address " + device.getIpv4() + " for " + deviceName, e);
        }

        final SubscribeResult result = exchange(address, frame);
        if (result.isSuccess()) {
            selections.set(new SelectionKey(deviceName, rxChannel), source.getLabel());
            logger.info("AES67 subscribed {} channel {} -> {} (flow channel {})", deviceName, rxChannel,
                    source.getLabel(), source.flowChannel);
        } else {
            logger.warn("AES67 subscribe failed for {} channel {} -> {}: {}", deviceName, rxChannel,
                    source.getLabel(), result);
        }
        return result;
    }

    /**
     * Run a command exchange on the blocking pool and wait for it.
     */
    private SubscribeResult exchange(final InetAddress address, final byte[] frame) {
        final Future<SubscribeResult> pending = blockingExecutor.submit(() -> commandSender.send(address, frame));
        try {
            return pending.get();
        } catch (ExecutionException e) {
            logger.warn("Problem sending AES67 command to {}", address.getHostAddress(), e.getCause());
            return SubscribeResult.ioError(String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            return SubscribeResult.ioError("Interrupted waiting for " + address.getHostAddress());
        }
    }

    /**
     * <p>Choose the source for a device receive channel, the way a selection list would.</p>
     *
     * <ul>
     *     <li>{@link #SUBSCRIPTION_NONE} removes the channel's subscription.</li>
     *     <li>An {@code [AES67] Stream - Channel} label subscribes the channel to that stream channel.</li>
     *     <li>A {@code Device - Channel} label subscribes the channel to that Dante transmit channel.</li>
     * </ul>
     *
     * <p>Problems are logged rather than thrown.</p>
     *
     * @param deviceName the display name of the receiving device
     * @param rxChannel the receive channel number
     * @param option the chosen source
     *
     * @return {@code true} if the device accepted the change
     */
    @API(status = API.Status.STABLE)
    public boolean selectSource(String deviceName, int rxChannel, String option) {
        final DanteDevice device = getDevice(deviceName);
        if (device == null) {
            logger.error("Device not found: {}", deviceName);
            return false;
        }
        final Channel rx = device.getRxChannels().get(rxChannel);
        if (rx == null) {
            logger.error("RX channel {} not found on {}", rxChannel, deviceName);
            return false;
        }
        final SelectionKey key = new SelectionKey(deviceName, rxChannel);

        if (SUBSCRIPTION_NONE.equals(option)) {
            selections.clear(key);
            return withControl(deviceName, "remove subscription", control -> control.removeSubscription(rx));
        }

        if (option != null && option.startsWith(Reconciler.AES67_PREFIX)) {
            try {
                return subscribeAes67(deviceName, rxChannel, option).isSuccess();
            } catch (IllegalArgumentException e) {
                logger.error("Cannot subscribe {} channel {} to {}: {}", deviceName, rxChannel, option,
                        e.getMessage());
                return false;
            }
        }

        selections.clear(key);
        final int separator = (option == null)? -1 : option.indexOf(Reconciler.LABEL_SEPARATOR);
        if (separator < 0) {
            logger.error("Not a recognizable source: {}", option);
            return false;
        }
        final String txDeviceName = option.substring(0, separator);
        final String txChannelName = option.substring(separator + Reconciler.LABEL_SEPARATOR.length());
        final DanteDevice txDevice = getDevice(txDeviceName);
        if (txDevice == null) {
            logger.error("TX device not found: {}", txDeviceName);
            return false;
        }
        final Channel tx = txDevice.findTxChannel(txChannelName);
        if (tx == null) {
            logger.error("TX channel {} not found on {}", txChannelName, txDeviceName);
            return false;
        }
        return withControl(deviceName, "add subscription",
                control -> control.addSubscription(rx, tx, txDevice.getName()));
    }

    /**
     * Work out the current source of a device receive channel, as a selection list would show it.
     *
     * @param deviceName the display name of the receiving device
     * @param rxChannel the receive channel number
     *
     * @return the recorded AES67 selection if there is one, otherwise the {@code Device - Channel} the device
     *         reports the channel as subscribed to, otherwise {@link #SUBSCRIPTION_NONE}
     */
    @API(status = API.Status.STABLE)
    public String getCurrentSource(String deviceName, int rxChannel) {
        final String selected = (deviceName == null)? null : selections.get(new SelectionKey(deviceName, rxChannel));
        if (selected != null) {
            return selected;
        }
        final DanteDevice device = getDevice(deviceName);
        if (device == null) {
            return SUBSCRIPTION_NONE;
        }
        final Channel rx = device.getRxChannels().get(rxChannel);
        if (rx == null) {
            return SUBSCRIPTION_NONE;
        }
        for (Subscription subscription : device.getSubscriptions()) {
            if (rx.name.equals(subscription.rxChannelName) && isPresent(subscription.txDeviceName) &&
                    isPresent(subscription.txChannelName)) {
                return subscription.txDeviceName + Reconciler.LABEL_SEPARATOR + subscription.txChannelName;
            }
        }
        return SUBSCRIPTION_NONE;
    }

    /**
     * Subscribe a receive channel of one device to a transmit channel of another, identifying both by number.
     *
     * @param rxDeviceName the display name of the receiving device
     * @param rxChannel the receive channel number
     * @param txDeviceName the display name of the transmitting device
     * @param txChannel the transmit channel number
     *
     * @return {@code true} if the receiving device accepted the subscription
     */
    @API(status = API.Status.STABLE)
    public boolean addSubscription(String rxDeviceName, int rxChannel, String txDeviceName, int txChannel) {
        final DanteDevice rxDevice = getDevice(rxDeviceName);
        final DanteDevice txDevice = getDevice(txDeviceName);
        if (rxDevice == null || txDevice == null) {
            logger.error("Device not found: {}", (rxDevice == null)? rxDeviceName : txDeviceName);
            return false;
        }
        final Channel rx = rxDevice.getRxChannels().get(rxChannel);
        final Channel tx = txDevice.getTxChannels().get(txChannel);
        if (rx == null || tx == null) {
            logger.error("Channel not found: rx {} on {}, tx {} on {}", rxChannel, rxDeviceName, txChannel,
                    txDeviceName);
            return false;
        }
        return withControl(rxDeviceName, "add subscription",
                control -> control.addSubscription(rx, tx, txDevice.getName()));
    }

    /**
     * Remove whatever subscription a receive channel has, and forget any AES67 selection for it.
     *
     * @param rxDeviceName the display name of the receiving device
     * @param rxChannel the receive channel number
     *
     * @return {@code true} if the device accepted the removal
     */
    @API(status = API.Status.STABLE)
    public boolean removeSubscription(String rxDeviceName, int rxChannel) {
        final DanteDevice rxDevice = getDevice(rxDeviceName);
        if (rxDevice == null) {
            logger.error("Device not found: {}", rxDeviceName);
            return false;
        }
        final Channel rx = rxDevice.getRxChannels().get(rxChannel);
        if (rx == null) {
            logger.error("Channel not found: {}", rxChannel);
            return false;
        }
        selections.clear(new SelectionKey(rxDeviceName, rxChannel));
        return withControl(rxDeviceName, "remove subscription", control -> control.removeSubscription(rx));
    }

    /**
     * Ask a device to identify itself.
     *
     * @param deviceName the display name of the device
     *
     * @return {@code true} if the request was sent successfully
     */
    @API(status = API.Status.STABLE)
    public boolean identify(String deviceName) {
        return withControl(deviceName, "identify device", DeviceControl::identify);
    }

    /**
     * Change a device's sample rate.
     *
     * @param deviceName the display name of the device
     * @param hertz the new sample rate, one of {@link DeviceSettings#SAMPLE_RATES}
     *
     * @return {@code true} if the device accepted the change
     *
     * @throws IllegalArgumentException if the sample rate is not one Dante supports
     */
    @API(status = API.Status.STABLE)
    public boolean setSampleRate(String deviceName, int hertz) {
        if (!DeviceSettings.SAMPLE_RATES.contains(hertz)) {
            throw new IllegalArgumentException("Unsupported sample rate: " + hertz);
        }
        return withControl(deviceName, "set sample rate", control -> control.setSampleRate(hertz));
    }

    /**
     * Change a device's sample encoding.
     *
     * @param deviceName the display name of the device
     * @param bits the new bit depth, one of {@link DeviceSettings#ENCODINGS}
     *
     * @return {@code true} if the device accepted the change
     *
     * @throws IllegalArgumentException if the encoding is not one Dante supports
     */
    @API(status = API.Status.STABLE)
    public boolean setEncoding(String deviceName, int bits) {
        if (!DeviceSettings.ENCODINGS.contains(bits)) {
            throw new IllegalArgumentException("Unsupported encoding: " + bits);
        }
        return withControl(deviceName, "set encoding", control -> control.setEncoding(bits));
    }

    /**
     * Change a device's receive latency.
     *
     * @param deviceName the display name of the device
     * @param milliseconds the new latency
     *
     * @return {@code true} if the device accepted the change
     *
     * @throws IllegalArgumentException if the latency is not a positive number
     */
    @API(status = API.Status.STABLE)
    public boolean setLatency(String deviceName, double milliseconds) {
        if (!(milliseconds > 0.0) || Double.isInfinite(milliseconds)) {
            throw new IllegalArgumentException("Latency must be a positive number of milliseconds");
        }
        return withControl(deviceName, "set latency", control -> control.setLatency(milliseconds));
    }

    /**
     * Change the gain of a channel on an AVIO adapter. Input adapters have gain on their transmit channels,
     * output adapters on their receive channels.
     *
     * @param deviceName the display name of the device
     * @param channel the channel number
     * @param level the gain level, from {@link DeviceSettings#MINIMUM_GAIN_LEVEL} to
     *              {@link DeviceSettings#MAXIMUM_GAIN_LEVEL}
     *
     * @return {@code true} if the device accepted the change, {@code false} if it failed or the device has no
     *         adjustable gain
     *
     * @throws IllegalArgumentException if the level is out of range
     */
    @API(status = API.Status.STABLE)
    public boolean setGainLevel(String deviceName, int channel, int level) {
        if (level < DeviceSettings.MINIMUM_GAIN_LEVEL || level > DeviceSettings.MAXIMUM_GAIN_LEVEL) {
            throw new IllegalArgumentException("Gain level must be between " + DeviceSettings.MINIMUM_GAIN_LEVEL +
                    " and " + DeviceSettings.MAXIMUM_GAIN_LEVEL);
        }
        final DanteDevice device = getDevice(deviceName);
        if (device == null) {
            logger.error("Device not found: {}", deviceName);
            return false;
        }
        final GainDirection direction = DeviceSettings.gainDirectionForModel(device.getModelId());
        if (direction == null) {
            logger.error("Device {} (model {}) has no adjustable gain", deviceName, device.getModelId());
            return false;
        }
        final Map<Integer, Channel> channels = (direction == GainDirection.INPUT)?
                device.getTxChannels() : device.getRxChannels();
        if (!channels.containsKey(channel)) {
            logger.error("Channel {} not found on {}", channel, deviceName);
            return false;
        }
        return withControl(deviceName, "set gain", control -> control.setGainLevel(channel, level, direction));
    }

    /**
     * Switch a device's AES67 mode on or off, if the device supports it.
     *
     * @param deviceName the display name of the device
     * @param enabled whether AES67 mode should be on
     *
     * @return {@code true} if the device accepted the change, {@code false} if it failed or the device cannot
     *         do AES67
     */
    @API(status = API.Status.STABLE)
    public boolean setAes67(String deviceName, boolean enabled) {
        final DanteDevice device = getDevice(deviceName);
        if (device != null && device.getControl() != null && !device.getControl().supportsAes67()) {
            logger.warn("Device {} does not support AES67 mode", deviceName);
            return false;
        }
        return withControl(deviceName, enabled? "enable AES67" : "disable AES67",
                control -> control.setAes67(enabled));
    }

    /**
     * A request made over a device's control channel.
     */
    @FunctionalInterface
    private interface ControlRequest {
        void perform(DeviceControl control) throws IOException;
    }

    /**
     * Look up a device and make a request of it over its control channel, logging any failure.
     *
     * @param deviceName the display name of the device
     * @param description what the request does, for log messages
     * @param request the request
     *
     * @return {@code true} if the request succeeded
     */
    private boolean withControl(String deviceName, String description, ControlRequest request) {
        final DanteDevice device = getDevice(deviceName);
        if (device == null) {
            logger.error("Device not found: {}", deviceName);
            return false;
        }
        final DeviceControl control = device.getControl();
        if (control == null) {
            logger.error("No control channel for {}, cannot {}", deviceName, description);
            return false;
        }
        try {
            request.perform(control);
            return true;
        } catch (Exception e) {
            logger.error("Failed to {} on {}", description, deviceName, e);
            return false;
        }
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isEmpty();
    }

    @Override
    public String toString() {
        return "DanteNetwork[running:" + isRunning() + ", devices:" + getDevices().size() + ", streams:" +
                streamCache.size() + ", selections:" + selections.size() + "]";
    }
}
