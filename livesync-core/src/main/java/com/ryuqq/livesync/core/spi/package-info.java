/**
 * Service Provider Interfaces for the sync layer.
 *
 * <p>Adapters implement these interfaces to plug a concrete document store,
 * entity codecs and the pending-write tracker into the engine.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.livesync.core.spi.RemoteStore}: change feeds and writes</li>
 *   <li>{@link com.ryuqq.livesync.core.spi.DocumentCodec}: raw document ↔ entity</li>
 *   <li>{@link com.ryuqq.livesync.core.spi.PendingMutationTracker}: optimistic write window</li>
 * </ul>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
package com.ryuqq.livesync.core.spi;
