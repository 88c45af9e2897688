package com.ryuqq.livesync.testkit.contract;

import com.ryuqq.livesync.core.spi.DocumentCodec;
import com.ryuqq.livesync.core.spi.DocumentDecodeException;
import com.ryuqq.livesync.core.spi.RawDocument;

import java.util.Map;

/**
 * Codec for {@link TestTask}: {@code order} (number) and {@code title} (string).
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public final class TestTaskCodec implements DocumentCodec<TestTask> {

    @Override
    public TestTask decode(RawDocument document) {
        Object order = document.get("order");
        Object title = document.get("title");
        if (!(order instanceof Number)) {
            throw new DocumentDecodeException(document.id(), "order must be a number");
        }
        if (!(title instanceof String)) {
            throw new DocumentDecodeException(document.id(), "title must be a string");
        }
        return new TestTask(document.id(), ((Number) order).intValue(), (String) title);
    }

    @Override
    public Map<String, Object> encode(TestTask entity) {
        return entity.fields();
    }
}
