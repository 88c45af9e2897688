/**
 * In-memory pending-write tracker.
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
package com.ryuqq.livesync.adapter.inmemory.pending;
