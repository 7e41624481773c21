package com.tessera.eventstore;

import com.tessera.eventmodel.SchemaRegistry;
import org.junit.jupiter.api.DisplayName;

@DisplayName("InMemoryEventStore")
class InMemoryEventStoreTest extends EventStoreContractTest {

    @Override
    protected EventStore createStore(SchemaRegistry schemas) {
        return new InMemoryEventStore(schemas);
    }
}
