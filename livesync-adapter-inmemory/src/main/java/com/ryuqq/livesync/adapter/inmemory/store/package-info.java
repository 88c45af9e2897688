/**
 * In-memory remote document store.
 *
 * <p>Reference implementation of the {@link com.ryuqq.livesync.core.spi.RemoteStore} SPI,
 * used by the contract tests and for local development.</p>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
package com.ryuqq.livesync.adapter.inmemory.store;
