package com.ryuqq.livesync.core.reconcile;

import com.ryuqq.livesync.core.model.EntityId;
import com.ryuqq.livesync.core.model.RemoteDocument;
import com.ryuqq.livesync.core.model.SyncEntity;

record Item(EntityId id, int order, String title) implements SyncEntity {

    static Item of(String id, int order, String title) {
        return new Item(EntityId.of(id), order, title);
    }

    RemoteDocument<Item> committed() {
        return RemoteDocument.committed(this);
    }

    RemoteDocument<Item> echo() {
        return RemoteDocument.pendingWrite(this);
    }
}
