/**
 * <p>Finds the Dante devices on a network, and tracks what they can send and receive.</p>
 *
 * <p>The {@link org.deepsymmetry.dantelink.DanteNetwork} runs periodic refresh passes. Each pass browses for the
 * Dante mDNS services, which the {@link org.deepsymmetry.dantelink.DeviceConsolidator} folds into one
 * {@link org.deepsymmetry.dantelink.DanteDevice} per host, asks each device for its channels and subscriptions,
 * and listens for AES67 stream announcements. The {@link org.deepsymmetry.dantelink.Reconciler} then works out
 * which AES67 streams the devices are already subscribed to. Each pass publishes an immutable snapshot to any
 * registered {@link org.deepsymmetry.dantelink.SnapshotListener}.</p>
 *
 * <p>Routing is done through the same object: Dante-to-Dante subscriptions go over each device's control channel,
 * and AES67 subscriptions are sent using the command in the {@link org.deepsymmetry.dantelink.aes67} package.</p>
 */
package org.deepsymmetry.dantelink;
