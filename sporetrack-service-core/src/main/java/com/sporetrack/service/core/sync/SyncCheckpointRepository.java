package com.sporetrack.service.core.sync;

import com.sporetrack.service.core.store.CanonicalPosition;
import java.util.Optional;

/** High-water marks of named resync runs. */
public interface SyncCheckpointRepository {

    Optional<CanonicalPosition> load(String name);

    void save(String name, CanonicalPosition position);

    void clear(String name);
}
